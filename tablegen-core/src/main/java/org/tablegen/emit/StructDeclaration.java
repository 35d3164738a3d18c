package org.tablegen.emit;

import java.util.List;

/**
 * One generated struct: fields in column order and the sorted packages they import.
 */
public record StructDeclaration(String tableName, String structName, List<FieldDeclaration> fields, List<String> imports) {

    public StructDeclaration {
        fields = List.copyOf(fields);
        imports = List.copyOf(imports);
    }
}
