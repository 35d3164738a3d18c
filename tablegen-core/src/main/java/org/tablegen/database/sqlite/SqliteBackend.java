package org.tablegen.database.sqlite;

import org.tablegen.config.GeneratorSettings;
import org.tablegen.database.AbstractCatalogBackend;
import org.tablegen.database.DatabaseType;
import org.tablegen.database.session.CatalogSessionFactory;
import org.tablegen.model.Column;
import org.tablegen.model.Table;
import org.tablegen.model.naming.CaseStrategy;

import java.util.ArrayList;
import java.util.List;

/**
 * SQLite has no catalog views. Tables come from {@code sqlite_master}, columns from the
 * {@code pragma_table_info} table-valued function, reshaped to the aliases the other
 * backends select.
 * <p>
 * The database name is the path of the database file. There is no schema and no user.
 */
public class SqliteBackend extends AbstractCatalogBackend {

    public static final String DRIVER = "org.sqlite.JDBC";

    /*
     * Untyped columns get their storage affinity, BLOB. Primary key columns are reported
     * NOT NULL. A lone INTEGER primary key aliases the rowid and is marked auto_increment.
     */
    private static final String COLUMNS_SQL = """
            SELECT
                p.cid + 1 AS ordinal_position,
                p.name AS column_name,
                CASE WHEN TRIM(p.type) = '' THEN 'BLOB' ELSE p.type END AS data_type,
                p.dflt_value AS column_default,
                CASE WHEN p."notnull" = 0 AND p.pk = 0 THEN 'YES' ELSE 'NO' END AS is_nullable,
                NULL AS character_maximum_length,
                NULL AS numeric_precision,
                NULL AS constraint_name,
                CASE WHEN p.pk > 0 THEN 'PRIMARY KEY' END AS constraint_type,
                CASE WHEN p.pk > 0
                    AND UPPER(TRIM(p.type)) = 'INTEGER'
                    AND (SELECT COUNT(*) FROM pragma_table_info(?) WHERE pk > 0) = 1
                    THEN 'auto_increment' END AS extra
            FROM pragma_table_info(?) AS p
            ORDER BY p.cid
            """;

    public SqliteBackend(GeneratorSettings settings, CatalogSessionFactory sessionFactory) {
        super(settings, DRIVER, sessionFactory);
    }

    @Override
    public DatabaseType getDatabaseType() {
        return DatabaseType.SQLITE;
    }

    @Override
    protected String defaultUserName() {
        return null;
    }

    @Override
    protected CaseStrategy identifierCase() {
        return CaseStrategy.LOWER;
    }

    @Override
    public String scope() {
        return settings.getDatabaseName() == null ? "" : settings.getDatabaseName();
    }

    @Override
    public String dsn() {
        return "jdbc:sqlite:" + scope();
    }

    @Override
    public List<Table> listTables(List<String> nameFilter) {
        List<Object> args = new ArrayList<>();
        String in = andInClause("LOWER(name)", nameFilter, args);

        return selectTables("""
                SELECT name AS table_name
                FROM sqlite_master
                WHERE type = 'table'
                AND name NOT LIKE 'sqlite\\_%%' ESCAPE '\\'
                %s
                ORDER BY name
                """.formatted(in), args);
    }

    @Override
    public void prepareColumnFetch() {
        prepareColumnsQuery(COLUMNS_SQL);
    }

    @Override
    public void fetchColumns(Table table) {
        selectColumns(table, table.getName(), table.getName());
    }

    @Override
    public boolean isPrimaryKey(Column column) {
        return contains(column.getConstraintType(), "PRIMARY KEY");
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
                "CHARACTER",
                "VARCHAR",
                "VARYING CHARACTER",
                "NCHAR",
                "NATIVE CHARACTER",
                "NVARCHAR"
        );
    }

    @Override
    public List<String> getTextDatatypes() {
        return List.of(
                "TEXT",
                "CLOB",
                "BLOB"
        );
    }

    @Override
    public List<String> getIntegerDatatypes() {
        return List.of(
                "INTEGER",
                "INT",
                "TINYINT",
                "SMALLINT",
                "MEDIUMINT",
                "BIGINT",
                "UNSIGNED BIG INT",
                "INT2",
                "INT8"
        );
    }

    @Override
    public List<String> getFloatDatatypes() {
        return List.of(
                "REAL",
                "DOUBLE",
                "DOUBLE PRECISION",
                "FLOAT",
                "NUMERIC",
                "DECIMAL"
        );
    }

    @Override
    public List<String> getTemporalDatatypes() {
        return List.of(
                "DATE",
                "DATETIME",
                "TIMESTAMP",
                "TIME"
        );
    }
}
