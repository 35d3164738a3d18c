package org.tablegen.database.session;

import java.sql.SQLException;

@FunctionalInterface
public interface RowMapper<T> {
    T map(CatalogRow row) throws SQLException;
}
