package org.tablegen.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One column as reported by a catalog, before any classification.
 * <p>
 * Values are kept in the product's own vocabulary: {@code nullableFlag} holds the raw
 * sentinel ({@code "YES"}, {@code "Y"} …) and {@code constraintType} the raw constraint
 * label, so only the backend that produced a column can interpret it.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Column {
    int ordinalPosition;
    String name;
    String dataType;
    String defaultValue;
    String nullableFlag;
    Integer characterMaximumLength;
    Integer numericPrecision;
    String constraintName;
    String constraintType;
    String extra;
}
