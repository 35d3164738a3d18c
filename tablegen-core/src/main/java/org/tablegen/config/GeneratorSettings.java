package org.tablegen.config;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.tablegen.options.TablegenOptions;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Everything a generation run is configured with. Assembled once by the caller (CLI
 * options merged with the {@code tablegen.yaml} profile) and only read afterwards.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GeneratorSettings {
    @Builder.Default private String databaseType = TablegenOptions.Database.TYPE_DEFAULT;
    @Builder.Default private String host = TablegenOptions.Database.HOST_DEFAULT;
    private String port;
    private String user;
    @ToString.Exclude
    private String password;
    private String databaseName;
    private String schema;
    private String socket;
    @Builder.Default private String sslMode = TablegenOptions.Database.SSL_MODE_DEFAULT;
    @Builder.Default private List<String> tables = new ArrayList<>();
    private boolean verbose;

    @Builder.Default private List<String> tags = new ArrayList<>(List.of(TablegenOptions.Generator.TAGS_DEFAULT));
    @Builder.Default private String naming = TablegenOptions.Generator.NAMING_DEFAULT;
    @Builder.Default private String nullType = TablegenOptions.Generator.NULL_TYPE_DEFAULT;

    @Builder.Default private String packageName = TablegenOptions.Output.PACKAGE_DEFAULT;
    @Builder.Default private String prefix = "";
    @Builder.Default private String suffix = "";
    @Builder.Default private Path outputDirectory = Path.of(TablegenOptions.Output.DIRECTORY_DEFAULT);
    @Builder.Default private String fileNameFormat = TablegenOptions.Output.FILE_NAME_FORMAT_DEFAULT;
    private Path schemaJson;

    /** Port as configured, or {@code fallback} when none was given. */
    public String portOr(String fallback) {
        return port == null || port.isBlank() ? fallback : port;
    }

    /** User as configured, or {@code fallback} when none was given. */
    public String userOr(String fallback) {
        return user == null || user.isBlank() ? fallback : user;
    }

    public boolean hasSocket() {
        return socket != null && !socket.isBlank();
    }
}
