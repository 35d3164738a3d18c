package org.tablegen.model;

import java.util.List;

/**
 * Semantic category of a native column type. Never stored; derived per column by the
 * backend that loaded it.
 */
public enum TypeCategory {
    STRING,
    TEXT,
    INTEGER,
    FLOAT,
    TEMPORAL,
    UNKNOWN;

    /**
     * Order in which categories are tested. The first match wins, so a native type listed
     * under two categories (Oracle {@code NUMBER}) resolves to the earlier one.
     */
    public static final List<TypeCategory> CLASSIFICATION_ORDER = List.of(STRING, TEXT, INTEGER, FLOAT, TEMPORAL);
}
