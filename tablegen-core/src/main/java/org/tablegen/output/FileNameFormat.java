package org.tablegen.output;

import org.tablegen.spi.naming.impl.CamelCaseNamingStrategy;

import java.util.Locale;

/**
 * How generated file names are derived from table names ({@code --file-name-format}).
 */
public enum FileNameFormat {
    /** {@code order_items.go} */
    SNAKE("snake") {
        @Override
        public String baseName(String tableName) {
            StringBuilder result = new StringBuilder(tableName.length());
            for (char c : tableName.toLowerCase(Locale.ROOT).toCharArray()) {
                result.append(Character.isLetterOrDigit(c) ? c : '_');
            }
            return result.toString();
        }
    },
    /** {@code orderItems.go} */
    CAMEL("camel") {
        @Override
        public String baseName(String tableName) {
            String camel = CAMEL_CASE.toStructName(tableName);
            return Character.toLowerCase(camel.charAt(0)) + camel.substring(1);
        }
    };

    private static final CamelCaseNamingStrategy CAMEL_CASE = new CamelCaseNamingStrategy();

    private final String id;

    FileNameFormat(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public abstract String baseName(String tableName);

    public String fileName(String tableName) {
        return baseName(tableName) + ".go";
    }

    public static FileNameFormat fromId(String id) {
        String key = id == null ? "" : id.trim().toLowerCase(Locale.ROOT);
        for (FileNameFormat format : values()) {
            if (format.id.equals(key)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown file name format '" + id + "', expected one of [snake, camel]");
    }
}
