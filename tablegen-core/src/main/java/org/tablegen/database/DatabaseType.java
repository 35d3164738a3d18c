package org.tablegen.database;

import org.tablegen.exception.UnsupportedDatabaseException;

import java.util.List;
import java.util.Locale;

public enum DatabaseType {
    POSTGRES("pg", "postgres", "postgresql"),
    MYSQL("mysql"),
    ORACLE("oracle"),
    SQLITE("sqlite", "sqlite3");

    private final List<String> ids;

    DatabaseType(String... ids) {
        this.ids = List.of(ids);
    }

    /**
     * Canonical identifier, as accepted by {@code --type}.
     */
    public String id() {
        return ids.get(0);
    }

    public List<String> ids() {
        return ids;
    }

    /**
     * @throws UnsupportedDatabaseException when no product answers to {@code id}
     */
    public static DatabaseType fromId(String id) {
        if (id != null) {
            String key = id.trim().toLowerCase(Locale.ROOT);
            for (DatabaseType type : values()) {
                if (type.ids.contains(key)) {
                    return type;
                }
            }
        }
        throw new UnsupportedDatabaseException(id);
    }
}
