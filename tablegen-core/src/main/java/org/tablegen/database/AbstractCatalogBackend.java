package org.tablegen.database;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tablegen.config.GeneratorSettings;
import org.tablegen.database.session.CatalogRow;
import org.tablegen.database.session.CatalogSession;
import org.tablegen.database.session.CatalogSessionFactory;
import org.tablegen.database.session.PreparedCatalogQuery;
import org.tablegen.database.session.RowMapper;
import org.tablegen.exception.ConnectionException;
import org.tablegen.exception.PrepareException;
import org.tablegen.exception.QueryException;
import org.tablegen.model.Column;
import org.tablegen.model.Table;
import org.tablegen.model.naming.CaseStrategy;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Session handling shared by every backend: opening and closing the catalog session,
 * compiling the column statement, wrapping driver failures into the tablegen exceptions
 * and printing verbose diagnostics. Catalog SQL and column rules stay in the subclasses.
 */
public abstract class AbstractCatalogBackend implements CatalogBackend {

    private static final Logger log = LoggerFactory.getLogger(AbstractCatalogBackend.class);

    /**
     * Reads the aliases every backend's column query selects.
     */
    protected static final RowMapper<Column> COLUMN_MAPPER = AbstractCatalogBackend::mapColumn;

    protected final GeneratorSettings settings;
    private final String driverClassName;
    private final CatalogSessionFactory sessionFactory;

    protected CatalogSession session;
    protected PreparedCatalogQuery columnsQuery;

    protected AbstractCatalogBackend(GeneratorSettings settings, String driverClassName, CatalogSessionFactory sessionFactory) {
        this.settings = settings;
        this.driverClassName = driverClassName;
        this.sessionFactory = sessionFactory;
    }

    protected abstract String defaultUserName();

    /**
     * Case convention table filters are folded to before binding.
     */
    protected abstract CaseStrategy identifierCase();

    public String getDriverClassName() {
        return driverClassName;
    }

    @Override
    public void connect() {
        String dsn = dsn();
        try {
            session = sessionFactory.open(dsn, settings.userOr(defaultUserName()), settings.getPassword(), driverClassName);
        } catch (SQLException e) {
            if (settings.isVerbose()) {
                log.info("> Error at connect()");
                log.info("> dsn: {}", dsn);
            }
            throw new ConnectionException(dsn, e);
        }
    }

    @Override
    public void close() {
        if (columnsQuery != null) {
            columnsQuery.close();
            columnsQuery = null;
        }
        if (session != null) {
            session.close();
            session = null;
        }
    }

    protected CatalogSession requireSession() {
        if (session == null) {
            throw new IllegalStateException(getDatabaseType().id() + " backend is not connected");
        }
        return session;
    }

    /**
     * Runs a table listing whose single result column is {@code table_name}.
     */
    protected List<Table> selectTables(String sql, List<Object> args) {
        try {
            return requireSession().select(sql, row -> new Table(row.getString("table_name")), args);
        } catch (SQLException e) {
            if (settings.isVerbose()) {
                log.info("> Error at listTables()");
                log.info("> scope: {}", scope());
            }
            throw new QueryException(null, scope(), e);
        }
    }

    protected void prepareColumnsQuery(String sql) {
        try {
            columnsQuery = requireSession().prepare(sql);
        } catch (SQLException e) {
            throw new PrepareException("Cannot prepare column query of " + getDatabaseType().id() + " backend", e);
        }
    }

    /**
     * Executes the prepared column statement and attaches the result to {@code table}.
     */
    protected void selectColumns(Table table, Object... args) {
        if (columnsQuery == null) {
            throw new IllegalStateException("prepareColumnFetch() must run before fetchColumns()");
        }
        try {
            table.attachColumns(columnsQuery.select(COLUMN_MAPPER, args));
        } catch (SQLException e) {
            if (settings.isVerbose()) {
                log.info("> Error at fetchColumns({})", table.getName());
                log.info("> scope: {}", scope());
            }
            throw new QueryException(table.getName(), scope(), e);
        }
    }

    /**
     * Appends {@code AND field IN (?, …)} for a non-empty filter and adds the folded
     * names to {@code args}.
     */
    protected String andInClause(String field, List<String> names, List<Object> args) {
        List<String> folded = identifierCase().normalizeAll(names);
        if (field == null || field.isEmpty() || folded.isEmpty()) {
            return "";
        }
        List<String> placeholders = new ArrayList<>(folded.size());
        for (String name : folded) {
            placeholders.add("?");
            args.add(name);
        }
        return "AND " + field + " IN (" + String.join(", ", placeholders) + ")";
    }

    protected static boolean contains(String value, String marker) {
        return value != null && value.contains(marker);
    }

    /*
     * Reads strictly in select-list order: Oracle streams LONG columns (DATA_DEFAULT) and
     * drops them when a later column is read first.
     */
    private static Column mapColumn(CatalogRow row) throws SQLException {
        Integer ordinal = row.getInteger("ordinal_position");
        String name = row.getString("column_name");
        String dataType = row.getString("data_type");
        if (dataType == null || dataType.isBlank()) {
            throw new SQLException("Catalog reported no data type for column " + name);
        }
        return Column.builder()
                .ordinalPosition(ordinal == null ? 0 : ordinal)
                .name(name)
                .dataType(dataType.trim())
                .defaultValue(row.getString("column_default"))
                .nullableFlag(row.getString("is_nullable"))
                .characterMaximumLength(row.getInteger("character_maximum_length"))
                .numericPrecision(row.getInteger("numeric_precision"))
                .constraintName(row.getString("constraint_name"))
                .constraintType(row.getString("constraint_type"))
                .extra(row.getString("extra"))
                .build();
    }
}
