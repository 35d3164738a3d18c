package org.tablegen.database.postgres;

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

/**
 * PostgreSQL through the SQL-standard {@code information_schema} views.
 */
public class PostgresBackend extends AbstractCatalogBackend {

    public static final String DRIVER = "org.postgresql.Driver";

    private static final String DEFAULT_USER = "postgres";
    private static final String DEFAULT_PORT = "5432";
    private static final String DEFAULT_SCHEMA = "public";
    private static final String UNIX_SOCKET_FACTORY = "org.newsclub.net.unix.AFUNIXSocketFactory$FactoryArg";

    private static final String COLUMNS_SQL = """
            SELECT
                ic.ordinal_position,
                ic.column_name,
                ic.data_type,
                ic.column_default,
                ic.is_nullable,
                ic.character_maximum_length,
                ic.numeric_precision,
                pk.constraint_name,
                pk.constraint_type,
                NULL AS extra
            FROM information_schema.columns AS ic
                LEFT JOIN (
                    SELECT ikcu.column_name, itc.constraint_name, itc.constraint_type
                    FROM information_schema.table_constraints AS itc
                        JOIN information_schema.key_column_usage AS ikcu
                            ON ikcu.constraint_schema = itc.constraint_schema
                            AND ikcu.constraint_name = itc.constraint_name
                            AND ikcu.table_name = itc.table_name
                    WHERE itc.constraint_type = 'PRIMARY KEY'
                    AND itc.table_name = ?
                    AND itc.table_schema = ?
                ) AS pk ON pk.column_name = ic.column_name
            WHERE ic.table_name = ?
            AND ic.table_schema = ?
            ORDER BY ic.ordinal_position
            """;

    public PostgresBackend(GeneratorSettings settings, CatalogSessionFactory sessionFactory) {
        super(settings, DRIVER, sessionFactory);
    }

    @Override
    public DatabaseType getDatabaseType() {
        return DatabaseType.POSTGRES;
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
        return schema == null || schema.isBlank() ? DEFAULT_SCHEMA : schema;
    }

    @Override
    public String dsn() {
        String db = settings.getDatabaseName() == null ? "" : settings.getDatabaseName();
        String sslMode = settings.getSslMode() == null ? "disable" : settings.getSslMode();
        if (settings.hasSocket()) {
            return "jdbc:postgresql://localhost/" + db
                    + "?socketFactory=" + UNIX_SOCKET_FACTORY
                    + "&socketFactoryArg=" + URLEncoder.encode(settings.getSocket(), StandardCharsets.UTF_8)
                    + "&sslmode=" + sslMode;
        }
        return "jdbc:postgresql://" + settings.getHost() + ":" + settings.portOr(DEFAULT_PORT) + "/" + db
                + "?sslmode=" + sslMode;
    }

    @Override
    public List<Table> listTables(List<String> nameFilter) {
        List<Object> args = new ArrayList<>();
        args.add(scope());
        String in = andInClause("LOWER(table_name)", nameFilter, args);

        return selectTables("""
                SELECT table_name
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
        selectColumns(table, table.getName(), scope(), table.getName(), scope());
    }

    @Override
    public boolean isPrimaryKey(Column column) {
        return contains(column.getConstraintType(), "PRIMARY KEY");
    }

    @Override
    public boolean isAutoIncrement(Column column) {
        return contains(column.getDefaultValue(), "nextval");
    }

    @Override
    public boolean isNullable(Column column) {
        return "YES".equals(column.getNullableFlag());
    }

    @Override
    public List<String> getStringDatatypes() {
        return List.of(
                "character varying",
                "varchar",
                "character",
                "char",
                "uuid"
        );
    }

    @Override
    public List<String> getTextDatatypes() {
        return List.of(
                "text"
        );
    }

    @Override
    public List<String> getIntegerDatatypes() {
        return List.of(
                "smallint",
                "integer",
                "bigint",
                "smallserial",
                "serial",
                "bigserial"
        );
    }

    @Override
    public List<String> getFloatDatatypes() {
        return List.of(
                "numeric",
                "decimal",
                "real",
                "double precision"
        );
    }

    @Override
    public List<String> getTemporalDatatypes() {
        return List.of(
                "time",
                "timestamp",
                "time with time zone",
                "timestamp with time zone",
                "time without time zone",
                "timestamp without time zone",
                "date"
        );
    }
}
