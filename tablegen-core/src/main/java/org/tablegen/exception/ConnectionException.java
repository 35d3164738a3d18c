package org.tablegen.exception;

/**
 * The database could not be reached or refused the credentials.
 */
public class ConnectionException extends TablegenException {
    private final String dsn;

    public ConnectionException(String dsn, Throwable cause) {
        super("Cannot connect to " + dsn + ": " + cause.getMessage(), cause);
        this.dsn = dsn;
    }

    public String getDsn() {
        return dsn;
    }
}
