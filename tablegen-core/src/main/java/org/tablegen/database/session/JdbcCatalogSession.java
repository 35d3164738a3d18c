package org.tablegen.database.session;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.pool.HikariPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * JDBC session over a single-connection HikariCP pool. The one connection is borrowed
 * when the session opens and held until {@link #close()}, so every catalog query of a
 * run goes through the same connection.
 */
public final class JdbcCatalogSession implements CatalogSession {

    private static final Logger log = LoggerFactory.getLogger(JdbcCatalogSession.class);

    private final HikariDataSource dataSource;
    private final Connection connection;
    private final List<JdbcPreparedCatalogQuery> prepared = new ArrayList<>();

    private JdbcCatalogSession(HikariDataSource dataSource, Connection connection) {
        this.dataSource = dataSource;
        this.connection = connection;
    }

    public static CatalogSession open(String dsn, String user, String password, String driverClassName) throws SQLException {
        HikariConfig hc = new HikariConfig();
        hc.setPoolName("tablegen");
        hc.setJdbcUrl(dsn);
        hc.setUsername(user);
        hc.setPassword(password);
        hc.setMaximumPoolSize(1);
        if (driverClassName != null) {
            try {
                hc.setDriverClassName(driverClassName);
            } catch (RuntimeException e) {
                // Hikari reports a driver missing from the classpath as a bare RuntimeException
                throw new SQLException("JDBC driver " + driverClassName + " is not available", e);
            }
        }

        HikariDataSource ds;
        try {
            ds = new HikariDataSource(hc);
        } catch (HikariPool.PoolInitializationException e) {
            throw new SQLException("Failed to initialize connection pool for " + dsn, e);
        }

        try {
            return new JdbcCatalogSession(ds, ds.getConnection());
        } catch (SQLException e) {
            ds.close();
            throw e;
        }
    }

    @Override
    public <T> List<T> select(String sql, RowMapper<T> mapper, List<?> args) throws SQLException {
        log.debug("catalog query sql={} args={}", sql, args);
        try (PreparedStatement stmt = connection.prepareStatement(sql)) {
            bind(stmt, args.toArray());
            return readAll(stmt, mapper);
        }
    }

    @Override
    public PreparedCatalogQuery prepare(String sql) throws SQLException {
        JdbcPreparedCatalogQuery query = new JdbcPreparedCatalogQuery(sql, connection.prepareStatement(sql));
        prepared.add(query);
        return query;
    }

    @Override
    public void close() {
        prepared.forEach(JdbcPreparedCatalogQuery::close);
        prepared.clear();
        try {
            connection.close();
        } catch (SQLException e) {
            log.warn("Failed to release catalog connection: {}", e.getMessage());
        } finally {
            dataSource.close();
        }
    }

    private static void bind(PreparedStatement stmt, Object[] args) throws SQLException {
        for (int i = 0; i < args.length; i++) {
            stmt.setObject(i + 1, args[i]);
        }
    }

    private static <T> List<T> readAll(PreparedStatement stmt, RowMapper<T> mapper) throws SQLException {
        List<T> rows = new ArrayList<>();
        try (ResultSet rs = stmt.executeQuery()) {
            CatalogRow row = new ResultSetCatalogRow(rs);
            while (rs.next()) {
                rows.add(mapper.map(row));
            }
        }
        return rows;
    }

    private static final class JdbcPreparedCatalogQuery implements PreparedCatalogQuery {
        private final String sql;
        private final PreparedStatement statement;

        JdbcPreparedCatalogQuery(String sql, PreparedStatement statement) {
            this.sql = sql;
            this.statement = statement;
        }

        @Override
        public <T> List<T> select(RowMapper<T> mapper, Object... args) throws SQLException {
            log.debug("catalog query sql={} args={}", sql, args);
            statement.clearParameters();
            bind(statement, args);
            return readAll(statement, mapper);
        }

        @Override
        public void close() {
            try {
                statement.close();
            } catch (SQLException e) {
                log.warn("Failed to close prepared catalog statement: {}", e.getMessage());
            }
        }
    }

    private static final class ResultSetCatalogRow implements CatalogRow {
        private final ResultSet rs;

        ResultSetCatalogRow(ResultSet rs) {
            this.rs = rs;
        }

        @Override
        public String getString(String label) throws SQLException {
            return rs.getString(label);
        }

        @Override
        public Integer getInteger(String label) throws SQLException {
            Object v = rs.getObject(label);
            if (v == null) {
                return null;
            }
            long value;
            if (v instanceof Number n) {
                value = n.longValue();
            } else {
                String s = v.toString().trim();
                if (s.isEmpty()) {
                    return null;
                }
                try {
                    value = new BigDecimal(s).longValueExact();
                } catch (NumberFormatException | ArithmeticException e) {
                    throw new SQLException("Column '" + label + "' is not an integer: " + s, e);
                }
            }
            // MySQL reports 4294967295 as the length of LONGTEXT/LONGBLOB, i.e. no usable bound
            if (value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
                log.debug("Column '{}' value {} does not fit an int, reading it as unbounded", label, value);
                return null;
            }
            return (int) value;
        }
    }
}
