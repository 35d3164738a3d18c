package org.tablegen.database.session;

import java.sql.SQLException;

/**
 * One result row, addressed by column label. Labels are matched case-insensitively,
 * as JDBC does, so Oracle's upper-cased aliases read the same as PostgreSQL's.
 */
public interface CatalogRow {
    String getString(String label) throws SQLException;

    /**
     * Numeric value narrowed to {@code Integer}; {@code null} for SQL NULL and for values
     * outside the {@code int} range.
     */
    Integer getInteger(String label) throws SQLException;
}
