package org.tablegen.cli;

import org.tablegen.config.ConfigurationLoader;
import org.tablegen.config.GeneratorSettings;
import org.tablegen.generate.GenerationResult;
import org.tablegen.generate.StructGenerationService;
import org.tablegen.options.TablegenOptions;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command for generating one Go struct file per database table.
 * Options left at their defaults are taken from the active {@code tablegen.yaml} profile.
 */
@CommandLine.Command(
        name = "generate",
        showDefaultValues = true,
        description = "데이터베이스 테이블마다 Go struct 파일을 생성합니다."
)
public class GenerateCommand implements Callable<Integer> {

    // -h is --host here, so only the long help option is registered
    @CommandLine.Option(names = "--help", usageHelp = true, description = "도움말을 출력합니다.")
    private boolean helpRequested;

    @CommandLine.Option(names = {"-t", "--type"}, description = "데이터베이스 종류 (pg, mysql, oracle, sqlite)", defaultValue = TablegenOptions.Database.TYPE_DEFAULT)
    private String type;
    @CommandLine.Option(names = {"-h", "--host"}, description = "데이터베이스 호스트", defaultValue = TablegenOptions.Database.HOST_DEFAULT)
    private String host;
    @CommandLine.Option(names = {"-p", "--port"}, description = "데이터베이스 포트 (기본값은 DB 종류별 기본 포트)")
    private String port;
    @CommandLine.Option(names = {"-u", "--user"}, description = "데이터베이스 사용자명")
    private String user;
    @CommandLine.Option(names = "--password", description = "데이터베이스 비밀번호", arity = "0..1", interactive = true)
    private String password;
    @CommandLine.Option(names = {"-d", "--database"}, description = "데이터베이스 이름 (sqlite는 파일 경로)")
    private String database;
    @CommandLine.Option(names = {"-s", "--schema"}, description = "스키마/owner (pg 기본값 public)")
    private String schema;
    @CommandLine.Option(names = "--socket", description = "unix 소켓 경로 (pg, mysql)")
    private String socket;
    @CommandLine.Option(names = "--sslmode", description = "SSL 모드", defaultValue = TablegenOptions.Database.SSL_MODE_DEFAULT)
    private String sslMode;
    @CommandLine.Option(names = "--tables", split = ",", description = "생성할 테이블 목록 (쉼표 구분, 생략 시 전체)")
    private List<String> tables = new ArrayList<>();
    @CommandLine.Option(names = {"-v", "--verbose"}, description = "실패 시 진단 정보를 출력합니다.")
    private boolean verbose;

    @CommandLine.Option(names = "--tags", split = ",", description = "태그 생성기 (db, stbl, json)", defaultValue = TablegenOptions.Generator.TAGS_DEFAULT)
    private List<String> tags;
    @CommandLine.Option(names = "--naming", description = "필드 네이밍 (camel, original)", defaultValue = TablegenOptions.Generator.NAMING_DEFAULT)
    private String naming;
    @CommandLine.Option(names = "--null", description = "nullable 컬럼 타입 (sql, native, primitive)", defaultValue = TablegenOptions.Generator.NULL_TYPE_DEFAULT)
    private String nullType;

    @CommandLine.Option(names = "--package", description = "생성 파일의 Go 패키지명", defaultValue = TablegenOptions.Output.PACKAGE_DEFAULT)
    private String packageName;
    @CommandLine.Option(names = "--prefix", description = "struct 이름 접두사", defaultValue = "")
    private String prefix;
    @CommandLine.Option(names = "--suffix", description = "struct 이름 접미사", defaultValue = "")
    private String suffix;
    @CommandLine.Option(names = {"-o", "--out"}, description = "생성된 .go 파일 저장 위치", defaultValue = TablegenOptions.Output.DIRECTORY_DEFAULT)
    private Path outputDir;
    @CommandLine.Option(names = "--file-name-format", description = "파일명 형식 (snake, camel)", defaultValue = TablegenOptions.Output.FILE_NAME_FORMAT_DEFAULT)
    private String fileNameFormat;
    @CommandLine.Option(names = "--schema-json", description = "로드한 스키마를 JSON으로 저장할 경로")
    private Path schemaJson;

    @CommandLine.Option(names = "--profile", description = "사용할 설정 프로파일 (dev, prod, test 등)")
    private String profile;

    private final ConfigurationLoader configurationLoader;
    private final StructGenerationService generationService;

    public GenerateCommand() {
        this(new ConfigurationLoader(), new StructGenerationService());
    }

    GenerateCommand(ConfigurationLoader configurationLoader, StructGenerationService generationService) {
        this.configurationLoader = configurationLoader;
        this.generationService = generationService;
    }

    @Override
    public Integer call() {
        try {
            GeneratorSettings settings = buildSettings(configurationLoader.loadConfiguration(profile));
            GenerationResult result = generationService.generate(settings);

            System.out.println("Generated " + result.files().size() + " struct file(s) in " + settings.getOutputDirectory());
            return 0;
        } catch (Exception e) {
            System.err.println("Generation failed: " + e.getMessage());
            if (verbose) {
                e.printStackTrace();
            }
            return 1;
        }
    }

    /**
     * Merges CLI options with the configuration profile.
     * Configuration values are only used when CLI options are not explicitly specified.
     */
    GeneratorSettings buildSettings(Map<String, String> config) {
        return GeneratorSettings.builder()
                .databaseType(pick(type, TablegenOptions.Database.TYPE_DEFAULT, config, TablegenOptions.Database.TYPE_KEY))
                .host(pick(host, TablegenOptions.Database.HOST_DEFAULT, config, TablegenOptions.Database.HOST_KEY))
                .port(pick(port, null, config, TablegenOptions.Database.PORT_KEY))
                .user(pick(user, null, config, TablegenOptions.Database.USER_KEY))
                .password(pick(password, null, config, TablegenOptions.Database.PASSWORD_KEY))
                .databaseName(pick(database, null, config, TablegenOptions.Database.NAME_KEY))
                .schema(pick(schema, null, config, TablegenOptions.Database.SCHEMA_KEY))
                .socket(pick(socket, null, config, TablegenOptions.Database.SOCKET_KEY))
                .sslMode(pick(sslMode, TablegenOptions.Database.SSL_MODE_DEFAULT, config, TablegenOptions.Database.SSL_MODE_KEY))
                .tables(pickList(tables, List.of(), config, TablegenOptions.Database.TABLES_KEY))
                .verbose(verbose)
                .tags(pickList(tags, List.of(TablegenOptions.Generator.TAGS_DEFAULT), config, TablegenOptions.Generator.TAGS_KEY))
                .naming(pick(naming, TablegenOptions.Generator.NAMING_DEFAULT, config, TablegenOptions.Generator.NAMING_KEY))
                .nullType(pick(nullType, TablegenOptions.Generator.NULL_TYPE_DEFAULT, config, TablegenOptions.Generator.NULL_TYPE_KEY))
                .packageName(pick(packageName, TablegenOptions.Output.PACKAGE_DEFAULT, config, TablegenOptions.Output.PACKAGE_KEY))
                .prefix(pick(prefix, "", config, TablegenOptions.Output.PREFIX_KEY))
                .suffix(pick(suffix, "", config, TablegenOptions.Output.SUFFIX_KEY))
                .outputDirectory(Path.of(pick(outputDir.toString(), TablegenOptions.Output.DIRECTORY_DEFAULT, config, TablegenOptions.Output.DIRECTORY_KEY)))
                .fileNameFormat(pick(fileNameFormat, TablegenOptions.Output.FILE_NAME_FORMAT_DEFAULT, config, TablegenOptions.Output.FILE_NAME_FORMAT_KEY))
                .schemaJson(schemaJson)
                .build();
    }

    private static String pick(String cliValue, String defaultValue, Map<String, String> config, String key) {
        boolean atDefault = cliValue == null || cliValue.equals(defaultValue);
        if (atDefault && config.get(key) != null) {
            return config.get(key);
        }
        return cliValue == null ? defaultValue : cliValue;
    }

    private static List<String> pickList(List<String> cliValue, List<String> defaultValue, Map<String, String> config, String key) {
        boolean atDefault = cliValue == null || cliValue.equals(defaultValue);
        if (atDefault && config.get(key) != null) {
            return splitList(config.get(key));
        }
        return cliValue == null ? new ArrayList<>(defaultValue) : new ArrayList<>(cliValue);
    }

    private static List<String> splitList(String value) {
        List<String> result = new ArrayList<>();
        Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .forEach(result::add);
        return result;
    }
}
