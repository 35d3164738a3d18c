package org.tablegen.exception;

public class UnsupportedDatabaseException extends TablegenException {
    private final String databaseType;

    public UnsupportedDatabaseException(String databaseType) {
        super("Unsupported database type: " + databaseType);
        this.databaseType = databaseType;
    }

    public String getDatabaseType() {
        return databaseType;
    }
}
