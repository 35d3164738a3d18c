package org.tablegen.emit;

/**
 * One generated struct field.
 *
 * @param tag space separated tag fragments, empty when no tag generator is active
 */
public record FieldDeclaration(String name, String type, String tag) {
}
