package org.tablegen.database;

import java.util.List;
import java.util.Locale;

/**
 * Case-insensitive lookup of a native type name in a backend's type list.
 */
public final class DatatypeMatcher {

    private DatatypeMatcher() {}

    /**
     * {@code dataType} matches a listed name when equal to it, or when it starts with it and
     * continues with a length/precision or a modifier: {@code VARCHAR(100)} matches
     * {@code VARCHAR}, {@code TIMESTAMP(6) WITH TIME ZONE} matches {@code TIMESTAMP},
     * {@code VARCHAR2} does not match {@code VARCHAR}.
     */
    public static boolean matches(String dataType, List<String> datatypes) {
        if (dataType == null || dataType.isBlank()) {
            return false;
        }
        String type = dataType.trim().toLowerCase(Locale.ROOT);
        for (String candidate : datatypes) {
            String c = candidate.toLowerCase(Locale.ROOT);
            if (type.equals(c)) {
                return true;
            }
            if (type.startsWith(c) && type.length() > c.length()) {
                char next = type.charAt(c.length());
                if (next == '(' || next == ' ') {
                    return true;
                }
            }
        }
        return false;
    }
}
