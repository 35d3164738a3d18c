package org.tablegen.database.mysql;

import org.tablegen.config.GeneratorSettings;
import org.tablegen.database.AbstractCatalogBackend;
import org.tablegen.database.DatabaseType;
import org.tablegen.database.session.CatalogSessionFactory;
import org.tablegen.model.Column;
import org.tablegen.model.Table;
import org.tablegen.model.naming.CaseStrategy;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * MySQL through its {@code information_schema}. A MySQL schema is a database, so
 * queries are scoped to the configured database name.
 */
public class MySqlBackend extends AbstractCatalogBackend {

    public static final String DRIVER = "com.mysql.cj.jdbc.Driver";

    private static final String DEFAULT_USER = "root";
    private static final String DEFAULT_PORT = "3306";
    private static final String UNIX_SOCKET_FACTORY = "org.newsclub.net.mysql.AFUNIXDatabaseSocketFactoryCJ";

    // libpq style ssl modes → Connector/J sslMode
    private static final Map<String, String> SSL_MODES = Map.of(
            "disable", "DISABLED",
            "allow", "PREFERRED",
            "prefer", "PREFERRED",
            "require", "REQUIRED",
            "verify-ca", "VERIFY_CA",
            "verify-full", "VERIFY_IDENTITY"
    );

    private static final String COLUMNS_SQL = """
            SELECT
                ordinal_position AS ordinal_position,
                column_name AS column_name,
                data_type AS data_type,
                column_default AS column_default,
                is_nullable AS is_nullable,
                character_maximum_length AS character_maximum_length,
                numeric_precision AS numeric_precision,
                CASE WHEN column_key = 'PRI' THEN 'PRIMARY' END AS constraint_name,
                column_key AS constraint_type,
                extra AS extra
            FROM information_schema.columns
            WHERE table_name = ?
            AND table_schema = ?
            ORDER BY ordinal_position
            """;

    public MySqlBackend(GeneratorSettings settings, CatalogSessionFactory sessionFactory) {
        super(settings, DRIVER, sessionFactory);
    }

    @Override
    public DatabaseType getDatabaseType() {
        return DatabaseType.MYSQL;
    }

    @Override
    protected String defaultUserName() {
        return DEFAULT_USER;
    }

    @Override
    protected CaseStrategy identifierCase() {
        return CaseStrategy.LOWER;
    }

    @Override
    public String scope() {
        String schema = settings.getSchema();
        return schema == null || schema.isBlank() ? settings.getDatabaseName() : schema;
    }

    @Override
    public String dsn() {
        String db = settings.getDatabaseName() == null ? "" : settings.getDatabaseName();
        List<String> params = new ArrayList<>();
        String base;
        if (settings.hasSocket()) {
            base = "jdbc:mysql://localhost/" + db;
            params.add("socketFactory=" + UNIX_SOCKET_FACTORY);
            params.add("junixsocket.file=" + URLEncoder.encode(settings.getSocket(), StandardCharsets.UTF_8));
        } else {
            base = "jdbc:mysql://" + settings.getHost() + ":" + settings.portOr(DEFAULT_PORT) + "/" + db;
        }
        String sslMode = settings.getSslMode();
        if (sslMode != null && !sslMode.isBlank()) {
            String key = sslMode.trim().toLowerCase(Locale.ROOT);
            params.add("sslMode=" + SSL_MODES.getOrDefault(key, sslMode.trim().toUpperCase(Locale.ROOT)));
        }
        return params.isEmpty() ? base : base + "?" + String.join("&", params);
    }

    @Override
    public List<Table> listTables(List<String> nameFilter) {
        List<Object> args = new ArrayList<>();
        args.add(scope());
        String in = andInClause("LOWER(table_name)", nameFilter, args);

        return selectTables("""
                SELECT table_name AS table_name
                FROM information_schema.tables
                WHERE table_type = 'BASE TABLE'
                AND table_schema = ?
                %s
                ORDER BY table_name
                """.formatted(in), args);
    }

    @Override
    public void prepareColumnFetch() {
        prepareColumnsQuery(COLUMNS_SQL);
    }

    @Override
    public void fetchColumns(Table table) {
        selectColumns(table, table.getName(), scope());
    }

    @Override
    public boolean isPrimaryKey(Column column) {
        return contains(column.getConstraintType(), "PRI");
    }

    @Override
    public boolean isAutoIncrement(Column column) {
        return contains(column.getExtra(), "auto_increment");
    }

    @Override
    public boolean isNullable(Column column) {
        return "YES".equals(column.getNullableFlag());
    }

    @Override
    public List<String> getStringDatatypes() {
        return List.of(
                "char",
                "varchar",
                "binary",
                "varbinary",
                "enum",
                "set"
        );
    }

    @Override
    public List<String> getTextDatatypes() {
        return List.of(
                "tinytext",
                "text",
                "mediumtext",
                "longtext",
                "tinyblob",
                "blob",
                "mediumblob",
                "longblob",
                "json"
        );
    }

    @Override
    public List<String> getIntegerDatatypes() {
        return List.of(
                "tinyint",
                "smallint",
                "mediumint",
                "int",
                "integer",
                "bigint"
        );
    }

    @Override
    public List<String> getFloatDatatypes() {
        return List.of(
                "numeric",
                "decimal",
                "float",
                "real",
                "double",
                "double precision"
        );
    }

    @Override
    public List<String> getTemporalDatatypes() {
        return List.of(
                "time",
                "timestamp",
                "date",
                "datetime",
                "year"
        );
    }
}
