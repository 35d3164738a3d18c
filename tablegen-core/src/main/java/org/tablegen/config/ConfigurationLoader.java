package org.tablegen.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tablegen.options.TablegenOptions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

public class ConfigurationLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigurationLoader.class);

    private static final String CONFIG_FILE_NAME = TablegenOptions.Profile.CONFIG_FILE;
    private static final String DEFAULT_PROFILE = TablegenOptions.Profile.DEFAULT;
    private static final String PROFILE_ENV_VAR = TablegenOptions.Profile.ENV_VAR;

    private final ObjectMapper yamlMapper;
    private final Path startDirectory;
    private final Function<String, String> environment;

    public ConfigurationLoader() {
        this(Paths.get("").toAbsolutePath());
    }

    public ConfigurationLoader(Path startDirectory) {
        this(startDirectory, System::getenv);
    }

    ConfigurationLoader(Path startDirectory, Function<String, String> environment) {
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
        this.startDirectory = startDirectory;
        this.environment = environment;
    }

    /**
     * 설정을 로드하고 지정된 프로파일을 적용
     *
     * 우선순위: CLI 프로파일 > 환경변수 > 기본값(dev)
     *
     * @param cliProfile CLI에서 지정된 프로파일 (null 가능)
     * @return 기본값 위에 프로파일 값을 덮어쓴 설정 맵
     */
    public Map<String, String> loadConfiguration(String cliProfile) {
        String activeProfile = resolveActiveProfile(cliProfile);

        Optional<TablegenConfiguration> config = findAndLoadConfiguration();
        if (config.isEmpty()) {
            return createDefaultConfiguration();
        }

        return extractConfigurationForProfile(config.get(), activeProfile);
    }

    String resolveActiveProfile(String cliProfile) {
        if (cliProfile != null && !cliProfile.trim().isEmpty()) {
            return cliProfile;
        }

        String envProfile = environment.apply(PROFILE_ENV_VAR);
        if (envProfile != null && !envProfile.trim().isEmpty()) {
            return envProfile;
        }

        return DEFAULT_PROFILE;
    }

    /**
     * 시작 디렉토리부터 상위 디렉토리로 올라가며 tablegen.yaml을 찾습니다.
     */
    private Optional<TablegenConfiguration> findAndLoadConfiguration() {
        Path currentDir = startDirectory;

        while (currentDir != null) {
            Path configFile = currentDir.resolve(CONFIG_FILE_NAME);
            if (Files.exists(configFile)) {
                try {
                    return Optional.of(yamlMapper.readValue(configFile.toFile(), TablegenConfiguration.class));
                } catch (IOException e) {
                    log.warn("Failed to parse {}: {}", configFile, e.getMessage());
                    return Optional.empty();
                }
            }
            currentDir = currentDir.getParent();
        }

        return Optional.empty();
    }

    private Map<String, String> extractConfigurationForProfile(TablegenConfiguration config, String profile) {
        var profileConfig = config.getProfiles().get(profile);
        if (profileConfig == null) {
            log.warn("Profile '{}' not found in {}. Using defaults.", profile, CONFIG_FILE_NAME);
            return createDefaultConfiguration();
        }

        var configMap = new HashMap<>(createDefaultConfiguration());

        var db = profileConfig.getDatabase();
        if (db != null) {
            putIfPresent(configMap, TablegenOptions.Database.TYPE_KEY, db.getType());
            putIfPresent(configMap, TablegenOptions.Database.HOST_KEY, db.getHost());
            putIfPresent(configMap, TablegenOptions.Database.PORT_KEY, db.getPort());
            putIfPresent(configMap, TablegenOptions.Database.USER_KEY, db.getUser());
            putIfPresent(configMap, TablegenOptions.Database.PASSWORD_KEY, db.getPassword());
            putIfPresent(configMap, TablegenOptions.Database.NAME_KEY, db.getName());
            putIfPresent(configMap, TablegenOptions.Database.SCHEMA_KEY, db.getSchema());
            putIfPresent(configMap, TablegenOptions.Database.SOCKET_KEY, db.getSocket());
            putIfPresent(configMap, TablegenOptions.Database.SSL_MODE_KEY, db.getSslMode());
            putIfPresent(configMap, TablegenOptions.Database.TABLES_KEY, join(db.getTables()));
        }

        var generator = profileConfig.getGenerator();
        if (generator != null) {
            putIfPresent(configMap, TablegenOptions.Generator.TAGS_KEY, join(generator.getTags()));
            putIfPresent(configMap, TablegenOptions.Generator.NAMING_KEY, generator.getNaming());
            putIfPresent(configMap, TablegenOptions.Generator.NULL_TYPE_KEY, generator.getNullType());
        }

        var output = profileConfig.getOutput();
        if (output != null) {
            putIfPresent(configMap, TablegenOptions.Output.DIRECTORY_KEY, output.getDirectory());
            putIfPresent(configMap, TablegenOptions.Output.PACKAGE_KEY, output.getPackageName());
            putIfPresent(configMap, TablegenOptions.Output.PREFIX_KEY, output.getPrefix());
            putIfPresent(configMap, TablegenOptions.Output.SUFFIX_KEY, output.getSuffix());
            putIfPresent(configMap, TablegenOptions.Output.FILE_NAME_FORMAT_KEY, output.getFileNameFormat());
        }

        return configMap;
    }

    private static void putIfPresent(Map<String, String> target, String key, String value) {
        if (value != null && !value.isBlank()) {
            target.put(key, value.trim());
        }
    }

    private static String join(List<String> values) {
        return values == null ? null : String.join(",", values);
    }

    private Map<String, String> createDefaultConfiguration() {
        return Map.of(
                TablegenOptions.Database.TYPE_KEY, TablegenOptions.Database.TYPE_DEFAULT,
                TablegenOptions.Database.HOST_KEY, TablegenOptions.Database.HOST_DEFAULT,
                TablegenOptions.Database.SSL_MODE_KEY, TablegenOptions.Database.SSL_MODE_DEFAULT,
                TablegenOptions.Generator.TAGS_KEY, TablegenOptions.Generator.TAGS_DEFAULT,
                TablegenOptions.Generator.NAMING_KEY, TablegenOptions.Generator.NAMING_DEFAULT,
                TablegenOptions.Generator.NULL_TYPE_KEY, TablegenOptions.Generator.NULL_TYPE_DEFAULT,
                TablegenOptions.Output.DIRECTORY_KEY, TablegenOptions.Output.DIRECTORY_DEFAULT,
                TablegenOptions.Output.PACKAGE_KEY, TablegenOptions.Output.PACKAGE_DEFAULT,
                TablegenOptions.Output.FILE_NAME_FORMAT_KEY, TablegenOptions.Output.FILE_NAME_FORMAT_DEFAULT
        );
    }
}
