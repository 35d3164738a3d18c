package org.tablegen.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.ToString;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Shape of {@code tablegen.yaml}.
 *
 * <pre>
 * profiles:
 *   dev:
 *     database: { type: pg, host: localhost, name: shop, schema: public }
 *     generator: { tags: [db, json], naming: camel, nullType: sql }
 *     output: { directory: gen/dto, package: dto }
 * </pre>
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class TablegenConfiguration {

    /**
     * 프로파일별 설정 맵
     */
    @JsonProperty("profiles")
    private Map<String, ProfileConfiguration> profiles = new HashMap<>();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ProfileConfiguration {

        @JsonProperty("database")
        private DatabaseConfiguration database;

        @JsonProperty("generator")
        private GeneratorConfiguration generator;

        @JsonProperty("output")
        private OutputConfiguration output;
    }

    /**
     * 데이터베이스 접속 설정
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DatabaseConfiguration {

        @JsonProperty("type")
        private String type;

        @JsonProperty("host")
        private String host;

        @JsonProperty("port")
        private String port;

        @JsonProperty("user")
        private String user;

        @ToString.Exclude
        @JsonProperty("password")
        private String password;

        @JsonProperty("name")
        private String name;

        @JsonProperty("schema")
        private String schema;

        @JsonProperty("socket")
        private String socket;

        @JsonProperty("sslMode")
        private String sslMode;

        @JsonProperty("tables")
        private List<String> tables;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GeneratorConfiguration {

        @JsonProperty("tags")
        private List<String> tags;

        @JsonProperty("naming")
        private String naming;

        @JsonProperty("nullType")
        private String nullType;
    }

    /**
     * 출력 관련 설정
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class OutputConfiguration {

        @JsonProperty("directory")
        private String directory;

        @JsonProperty("package")
        private String packageName;

        @JsonProperty("prefix")
        private String prefix;

        @JsonProperty("suffix")
        private String suffix;

        @JsonProperty("fileNameFormat")
        private String fileNameFormat;
    }
}
