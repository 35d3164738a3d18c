package org.tablegen.database.oracle;

import org.tablegen.config.GeneratorSettings;
import org.tablegen.database.AbstractCatalogBackend;
import org.tablegen.database.DatabaseType;
import org.tablegen.database.session.CatalogSessionFactory;
import org.tablegen.model.Column;
import org.tablegen.model.Table;
import org.tablegen.model.naming.CaseStrategy;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Oracle through the {@code ALL_*} data dictionary views, scoped to an owner.
 * Unquoted Oracle identifiers are stored upper-cased, so owner and table filters are
 * upper-cased before binding.
 */
public class OracleBackend extends AbstractCatalogBackend {

    public static final String DRIVER = "oracle.jdbc.OracleDriver";

    private static final String DEFAULT_USER = "system";
    private static final String DEFAULT_PORT = "1521";

    private static final String COLUMNS_SQL = """
            SELECT
                c.column_id AS ordinal_position,
                c.column_name AS column_name,
                c.data_type AS data_type,
                c.data_default AS column_default,
                c.nullable AS is_nullable,
                NULLIF(c.char_length, 0) AS character_maximum_length,
                c.data_precision AS numeric_precision,
                pk.constraint_name AS constraint_name,
                CASE WHEN pk.constraint_name IS NOT NULL THEN 'PRIMARY KEY' END AS constraint_type,
                NULL AS extra
            FROM all_tab_columns c
                LEFT JOIN (
                    SELECT cc.column_name, cons.constraint_name
                    FROM all_constraints cons
                        JOIN all_cons_columns cc
                            ON cc.owner = cons.owner
                            AND cc.constraint_name = cons.constraint_name
                            AND cc.table_name = cons.table_name
                    WHERE cons.constraint_type = 'P'
                    AND cons.table_name = ?
                    AND cons.owner = ?
                ) pk ON pk.column_name = c.column_name
            WHERE c.table_name = ?
            AND c.owner = ?
            ORDER BY c.column_id
            """;

    public OracleBackend(GeneratorSettings settings, CatalogSessionFactory sessionFactory) {
        super(settings, DRIVER, sessionFactory);
    }

    @Override
    public DatabaseType getDatabaseType() {
        return DatabaseType.ORACLE;
    }

    @Override
    protected String defaultUserName() {
        return DEFAULT_USER;
    }

    @Override
    protected CaseStrategy identifierCase() {
        return CaseStrategy.UPPER;
    }

    /**
     * The configured schema, or the connecting user when none was given.
     */
    @Override
    public String scope() {
        String owner = settings.getSchema();
        if (owner == null || owner.isBlank()) {
            owner = settings.userOr(DEFAULT_USER);
        }
        return owner.toUpperCase(Locale.ROOT);
    }

    /**
     * Thin driver URL in service-name form: {@code jdbc:oracle:thin:@//host:port/service}.
     */
    @Override
    public String dsn() {
        String service = settings.getDatabaseName() == null ? "" : settings.getDatabaseName();
        return "jdbc:oracle:thin:@//" + settings.getHost() + ":" + settings.portOr(DEFAULT_PORT) + "/" + service;
    }

    @Override
    public List<Table> listTables(List<String> nameFilter) {
        List<Object> args = new ArrayList<>();
        args.add(scope());
        String in = andInClause("table_name", nameFilter, args);

        return selectTables("""
                SELECT table_name AS table_name
                FROM all_tables
                WHERE owner = ?
                AND dropped = 'NO'
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

    /**
     * Identity columns (12c+) default to the next value of their system sequence,
     * e.g. {@code "HR"."ISEQ$$_73187".nextval}. Trigger-filled columns are not detected.
     */
    @Override
    public boolean isAutoIncrement(Column column) {
        String defaultValue = column.getDefaultValue();
        return defaultValue != null && defaultValue.toLowerCase(Locale.ROOT).contains(".nextval");
    }

    @Override
    public boolean isNullable(Column column) {
        return "Y".equals(column.getNullableFlag());
    }

    @Override
    public List<String> getStringDatatypes() {
        return List.of(
                "CHAR",
                "VARCHAR2",
                "NCHAR",
                "NVARCHAR2"
        );
    }

    @Override
    public List<String> getTextDatatypes() {
        return List.of(
                "CLOB",
                "NCLOB"
        );
    }

    /**
     * {@code NUMBER} is also listed as a float type. Integer is tested first, so every
     * {@code NUMBER} column classifies as integer regardless of its scale.
     */
    // TODO: use numeric precision/scale to tell NUMBER(p,0) from NUMBER(p,s) columns
    @Override
    public List<String> getIntegerDatatypes() {
        return List.of(
                "NUMBER",
                "INTEGER",
                "SMALLINT"
        );
    }

    @Override
    public List<String> getFloatDatatypes() {
        return List.of(
                "FLOAT",
                "BINARY_FLOAT",
                "BINARY_DOUBLE",
                "DECIMAL",
                "NUMBER",
                "REAL",
                "DOUBLE PRECISION"
        );
    }

    @Override
    public List<String> getTemporalDatatypes() {
        return List.of(
                "DATE",
                "TIMESTAMP",
                "TIMESTAMP WITH TIME ZONE",
                "TIMESTAMP WITH LOCAL TIME ZONE"
        );
    }
}
