package org.tablegen.cli;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.tablegen.config.ConfigurationLoader;
import org.tablegen.config.GeneratorSettings;
import org.tablegen.generate.StructGenerationService;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class GenerateCommandTest {

    @TempDir Path tmp;

    private GeneratorSettings settings(String... args) {
        ConfigurationLoader loader = new ConfigurationLoader(tmp);
        GenerateCommand command = new GenerateCommand(loader, new StructGenerationService());
        new CommandLine(command).parseArgs(args);
        return command.buildSettings(loader.loadConfiguration(null));
    }

    @Test
    @DisplayName("옵션을 주지 않으면 기본값")
    void defaults() {
        GeneratorSettings s = settings();

        assertThat(s.getDatabaseType()).isEqualTo("pg");
        assertThat(s.getHost()).isEqualTo("127.0.0.1");
        assertThat(s.getSslMode()).isEqualTo("disable");
        assertThat(s.getTags()).containsExactly("db");
        assertThat(s.getTables()).isEmpty();
        assertThat(s.getNaming()).isEqualTo("camel");
        assertThat(s.getNullType()).isEqualTo("sql");
        assertThat(s.getPackageName()).isEqualTo("dto");
        assertThat(s.getOutputDirectory()).isEqualTo(Path.of("output"));
        assertThat(s.getFileNameFormat()).isEqualTo("snake");
        assertThat(s.getPort()).isNull();
        assertThat(s.isVerbose()).isFalse();
    }

    @Test
    @DisplayName("짧은 옵션과 쉼표 목록을 읽는다")
    void shortOptions() {
        GeneratorSettings s = settings("-t", "mysql", "-h", "db.local", "-p", "3307", "-u", "app",
                "-d", "shop", "-s", "sales", "-v", "--tables", "orders,products", "--tags", "db,stbl,json",
                "-o", "gen");

        assertThat(s.getDatabaseType()).isEqualTo("mysql");
        assertThat(s.getHost()).isEqualTo("db.local");
        assertThat(s.getPort()).isEqualTo("3307");
        assertThat(s.getUser()).isEqualTo("app");
        assertThat(s.getDatabaseName()).isEqualTo("shop");
        assertThat(s.getSchema()).isEqualTo("sales");
        assertThat(s.isVerbose()).isTrue();
        assertThat(s.getTables()).containsExactly("orders", "products");
        assertThat(s.getTags()).containsExactly("db", "stbl", "json");
        assertThat(s.getOutputDirectory()).isEqualTo(Path.of("gen"));
    }

    @Test
    @DisplayName("기본값으로 남은 옵션만 설정 파일 값으로 채운다")
    void configFillsDefaultsOnly() throws Exception {
        Files.writeString(tmp.resolve("tablegen.yaml"), """
                profiles:
                  dev:
                    database:
                      type: oracle
                      user: hr
                      tables: [EMPLOYEES]
                    generator:
                      tags: [db, json]
                    output:
                      package: models
                      prefix: Db
                """);

        GeneratorSettings s = settings("--package", "entities", "-u", "scott");

        assertThat(s.getDatabaseType()).isEqualTo("oracle");
        assertThat(s.getTables()).containsExactly("EMPLOYEES");
        assertThat(s.getTags()).containsExactly("db", "json");
        assertThat(s.getPrefix()).isEqualTo("Db");
        assertThat(s.getPackageName()).isEqualTo("entities");
        assertThat(s.getUser()).isEqualTo("scott");
    }

    @Test
    void buildSettingsWithoutConfiguration() {
        ConfigurationLoader loader = new ConfigurationLoader(tmp);
        GenerateCommand command = new GenerateCommand(loader, new StructGenerationService());
        new CommandLine(command).parseArgs("--null", "primitive", "--naming", "original");

        GeneratorSettings s = command.buildSettings(Map.of());

        assertThat(s.getNullType()).isEqualTo("primitive");
        assertThat(s.getNaming()).isEqualTo("original");
        assertThat(s.getTags()).isEqualTo(List.of("db"));
    }
}
