package org.tablegen.database;

import org.tablegen.config.GeneratorSettings;
import org.tablegen.database.mysql.MySqlBackend;
import org.tablegen.database.oracle.OracleBackend;
import org.tablegen.database.postgres.PostgresBackend;
import org.tablegen.database.session.CatalogSessionFactory;
import org.tablegen.database.session.JdbcCatalogSession;
import org.tablegen.database.sqlite.SqliteBackend;
import org.tablegen.exception.UnsupportedDatabaseException;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Maps each {@link DatabaseType} to its JDBC driver and backend constructor.
 * Built once when the class initialises and never modified afterwards.
 */
public final class BackendRegistry {

    @FunctionalInterface
    public interface BackendFactory {
        CatalogBackend create(GeneratorSettings settings, CatalogSessionFactory sessionFactory);
    }

    public record Registration(String driverClassName, BackendFactory factory) {
    }

    private static final Map<DatabaseType, Registration> REGISTRATIONS;

    static {
        Map<DatabaseType, Registration> registrations = new EnumMap<>(DatabaseType.class);
        registrations.put(DatabaseType.POSTGRES, new Registration(PostgresBackend.DRIVER, PostgresBackend::new));
        registrations.put(DatabaseType.MYSQL, new Registration(MySqlBackend.DRIVER, MySqlBackend::new));
        registrations.put(DatabaseType.ORACLE, new Registration(OracleBackend.DRIVER, OracleBackend::new));
        registrations.put(DatabaseType.SQLITE, new Registration(SqliteBackend.DRIVER, SqliteBackend::new));
        REGISTRATIONS = Map.copyOf(registrations);
    }

    private BackendRegistry() {
    }

    public static Set<DatabaseType> supportedTypes() {
        return REGISTRATIONS.keySet();
    }

    /**
     * @throws UnsupportedDatabaseException when the id names no registered product
     */
    public static Registration lookup(String databaseType) {
        DatabaseType type = DatabaseType.fromId(databaseType);
        Registration registration = REGISTRATIONS.get(type);
        if (registration == null) {
            throw new UnsupportedDatabaseException(databaseType);
        }
        return registration;
    }

    /**
     * Backend for {@code settings.getDatabaseType()}, connecting through JDBC.
     */
    public static CatalogBackend create(GeneratorSettings settings) {
        return create(settings, JdbcCatalogSession::open);
    }

    public static CatalogBackend create(GeneratorSettings settings, CatalogSessionFactory sessionFactory) {
        return lookup(settings.getDatabaseType()).factory().create(settings, sessionFactory);
    }
}
