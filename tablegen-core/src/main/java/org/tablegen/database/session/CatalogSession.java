package org.tablegen.database.session;

import java.sql.SQLException;
import java.util.List;

/**
 * A live connection to one catalog: run a query with positional parameters and scan
 * the rows. A failed query raises {@link SQLException}; an empty result is just an
 * empty list.
 */
public interface CatalogSession extends AutoCloseable {

    <T> List<T> select(String sql, RowMapper<T> mapper, List<?> args) throws SQLException;

    /**
     * Compiles {@code sql} once so it can be executed repeatedly with different arguments.
     */
    PreparedCatalogQuery prepare(String sql) throws SQLException;

    @Override
    void close();
}
