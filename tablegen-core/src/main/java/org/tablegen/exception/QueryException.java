package org.tablegen.exception;

/**
 * A catalog query failed at runtime. Carries the table (absent for the table listing)
 * and the schema/owner the query was scoped to, which is usually enough to tell a
 * permission problem from a naming mismatch.
 */
public class QueryException extends TablegenException {
    private final String table;
    private final String scope;

    public QueryException(String table, String scope, Throwable cause) {
        super(describe(table, scope, cause), cause);
        this.table = table;
        this.scope = scope;
    }

    public String getTable() {
        return table;
    }

    public String getScope() {
        return scope;
    }

    private static String describe(String table, String scope, Throwable cause) {
        String target = table == null
                ? "Listing tables failed"
                : "Fetching columns of table '" + table + "' failed";
        return target + " (scope '" + scope + "'): " + cause.getMessage();
    }
}
