package org.tablegen.database;

import org.tablegen.model.Column;
import org.tablegen.model.Table;
import org.tablegen.model.TypeCategory;

import java.util.List;

/**
 * Schema introspection for one database product.
 * <p>
 * Lifecycle of a run: {@link #connect()}, {@link #listTables(List)},
 * {@link #prepareColumnFetch()} once, {@link #fetchColumns(Table)} per table, then
 * {@link #close()}. The remaining methods interpret columns this backend produced; their
 * sentinels and type names are product specific and must not be shared between products.
 */
public interface CatalogBackend extends AutoCloseable {

    DatabaseType getDatabaseType();

    /**
     * JDBC URL of the configured database, without credentials.
     */
    String dsn();

    /**
     * Schema, owner or database name queries are scoped to; used in diagnostics.
     */
    String scope();

    /**
     * @throws org.tablegen.exception.ConnectionException when the database is unreachable or rejects the login
     */
    void connect();

    /**
     * Base tables (never views) of the configured scope, ordered by name ascending.
     *
     * @param nameFilter restricts the result to these names, folded to the product's case
     *                   convention; {@code null} or empty lists everything
     * @throws org.tablegen.exception.QueryException carrying the scope
     */
    List<Table> listTables(List<String> nameFilter);

    /**
     * @throws org.tablegen.exception.PrepareException when the column statement does not compile
     */
    void prepareColumnFetch();

    /**
     * Attaches the table's columns in ordinal order.
     *
     * @throws org.tablegen.exception.QueryException carrying table and scope
     */
    void fetchColumns(Table table);

    boolean isPrimaryKey(Column column);

    boolean isAutoIncrement(Column column);

    boolean isNullable(Column column);

    List<String> getStringDatatypes();

    List<String> getTextDatatypes();

    List<String> getIntegerDatatypes();

    List<String> getFloatDatatypes();

    List<String> getTemporalDatatypes();

    default boolean isString(Column column) {
        return DatatypeMatcher.matches(column.getDataType(), getStringDatatypes());
    }

    default boolean isText(Column column) {
        return DatatypeMatcher.matches(column.getDataType(), getTextDatatypes());
    }

    default boolean isInteger(Column column) {
        return DatatypeMatcher.matches(column.getDataType(), getIntegerDatatypes());
    }

    default boolean isFloat(Column column) {
        return DatatypeMatcher.matches(column.getDataType(), getFloatDatatypes());
    }

    default boolean isTemporal(Column column) {
        return DatatypeMatcher.matches(column.getDataType(), getTemporalDatatypes());
    }

    /**
     * Tests the categories in {@link TypeCategory#CLASSIFICATION_ORDER}; the first hit wins.
     */
    default TypeCategory classify(Column column) {
        for (TypeCategory category : TypeCategory.CLASSIFICATION_ORDER) {
            if (matches(category, column)) {
                return category;
            }
        }
        return TypeCategory.UNKNOWN;
    }

    default boolean matches(TypeCategory category, Column column) {
        return switch (category) {
            case STRING -> isString(column);
            case TEXT -> isText(column);
            case INTEGER -> isInteger(column);
            case FLOAT -> isFloat(column);
            case TEMPORAL -> isTemporal(column);
            case UNKNOWN -> false;
        };
    }

    /**
     * Releases the session; safe to call when never connected.
     */
    @Override
    void close();
}
