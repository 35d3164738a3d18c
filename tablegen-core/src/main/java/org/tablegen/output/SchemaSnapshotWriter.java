package org.tablegen.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.tablegen.model.Table;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Dumps the loaded schema as JSON so catalogs can be diffed between runs.
 */
public class SchemaSnapshotWriter {

    /**
     * @param databaseType canonical product id, e.g. {@code pg}
     * @param scope        schema, owner or database the tables were listed from
     */
    public record SchemaSnapshot(String databaseType, String scope, List<Table> tables) {
    }

    private final ObjectMapper mapper;

    public SchemaSnapshotWriter() {
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void write(SchemaSnapshot snapshot, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writeValue(file.toFile(), snapshot);
    }

    public SchemaSnapshot read(Path file) throws IOException {
        return mapper.readValue(file.toFile(), SchemaSnapshot.class);
    }
}
