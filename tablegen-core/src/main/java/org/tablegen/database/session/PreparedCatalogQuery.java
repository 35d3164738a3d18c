package org.tablegen.database.session;

import java.sql.SQLException;
import java.util.List;

public interface PreparedCatalogQuery extends AutoCloseable {

    <T> List<T> select(RowMapper<T> mapper, Object... args) throws SQLException;

    @Override
    void close();
}
