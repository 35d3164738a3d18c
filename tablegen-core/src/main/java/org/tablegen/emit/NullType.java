package org.tablegen.emit;

import java.util.Locale;

/**
 * How nullable columns are represented in generated structs.
 */
public enum NullType {
    /** {@code sql.NullString}, {@code sql.NullInt64}, … */
    SQL("sql"),
    /** pointer types such as {@code *string} */
    NATIVE("native"),
    /** plain types; nullability is ignored */
    PRIMITIVE("primitive");

    private final String id;

    NullType(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static NullType fromId(String id) {
        String key = id == null ? "" : id.trim().toLowerCase(Locale.ROOT);
        for (NullType type : values()) {
            if (type.id.equals(key)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown null type '" + id + "', expected one of [sql, native, primitive]");
    }
}
