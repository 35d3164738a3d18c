package org.tablegen.database.session;

import java.sql.SQLException;

@FunctionalInterface
public interface CatalogSessionFactory {

    /**
     * @param dsn             JDBC URL without credentials
     * @param driverClassName driver registered for the backend
     */
    CatalogSession open(String dsn, String user, String password, String driverClassName) throws SQLException;
}
