package org.tablegen.emit;

import org.tablegen.model.TypeCategory;

import java.util.Map;
import java.util.Set;

import static java.util.Map.entry;

/**
 * Picks the Go field type for a column category, honouring the configured {@link NullType}
 * for nullable columns. Non-nullable columns always get the plain type.
 */
public class GoTypeMapper {

    public static final String SQL_PACKAGE = "database/sql";
    public static final String TIME_PACKAGE = "time";

    /**
     * A Go type plus the packages it needs imported.
     */
    public record GoType(String name, Set<String> imports) {
        static GoType of(String name, String... imports) {
            return new GoType(name, Set.of(imports));
        }
    }

    private record Variants(GoType plain, GoType sqlNull, GoType pointer) {
    }

    private static final GoType UNTYPED = GoType.of("interface{}");

    private static final Map<TypeCategory, Variants> TYPE_MAP = Map.ofEntries(
            entry(TypeCategory.STRING, new Variants(GoType.of("string"), GoType.of("sql.NullString", SQL_PACKAGE), GoType.of("*string"))),
            entry(TypeCategory.TEXT, new Variants(GoType.of("string"), GoType.of("sql.NullString", SQL_PACKAGE), GoType.of("*string"))),
            entry(TypeCategory.INTEGER, new Variants(GoType.of("int"), GoType.of("sql.NullInt64", SQL_PACKAGE), GoType.of("*int"))),
            entry(TypeCategory.FLOAT, new Variants(GoType.of("float64"), GoType.of("sql.NullFloat64", SQL_PACKAGE), GoType.of("*float64"))),
            entry(TypeCategory.TEMPORAL, new Variants(GoType.of("time.Time", TIME_PACKAGE), GoType.of("sql.NullTime", SQL_PACKAGE), GoType.of("*time.Time", TIME_PACKAGE))),
            // interface{} already holds nil
            entry(TypeCategory.UNKNOWN, new Variants(UNTYPED, UNTYPED, UNTYPED))
    );

    private final NullType nullType;

    public GoTypeMapper(NullType nullType) {
        this.nullType = nullType;
    }

    public NullType getNullType() {
        return nullType;
    }

    public GoType map(TypeCategory category, boolean nullable) {
        Variants variants = TYPE_MAP.getOrDefault(category, TYPE_MAP.get(TypeCategory.UNKNOWN));
        if (!nullable) {
            return variants.plain();
        }
        return switch (nullType) {
            case SQL -> variants.sqlNull();
            case NATIVE -> variants.pointer();
            case PRIMITIVE -> variants.plain();
        };
    }
}
