package org.tablegen.emit;

import java.util.List;

/**
 * Renders a {@link StructDeclaration} as a gofmt-formatted Go source file.
 */
public class GoStructRenderer {

    public static final String HEADER = "// Code generated by tablegen. DO NOT EDIT.";

    private final String packageName;

    public GoStructRenderer(String packageName) {
        this.packageName = packageName;
    }

    public String render(StructDeclaration struct) {
        StringBuilder out = new StringBuilder();
        out.append(HEADER).append("\n\n");
        out.append("package ").append(packageName).append("\n\n");
        appendImports(out, struct.imports());
        appendStruct(out, struct);
        return out.toString();
    }

    private void appendImports(StringBuilder out, List<String> imports) {
        if (imports.isEmpty()) {
            return;
        }
        if (imports.size() == 1) {
            out.append("import \"").append(imports.get(0)).append("\"\n\n");
            return;
        }
        out.append("import (\n");
        for (String path : imports) {
            out.append('\t').append('"').append(path).append("\"\n");
        }
        out.append(")\n\n");
    }

    /*
     * gofmt aligns names and types of consecutive fields with spaces; the type column is
     * only padded when a tag follows it.
     */
    private void appendStruct(StringBuilder out, StructDeclaration struct) {
        int nameWidth = 0;
        int typeWidth = 0;
        for (FieldDeclaration field : struct.fields()) {
            nameWidth = Math.max(nameWidth, width(field.name()));
            typeWidth = Math.max(typeWidth, width(field.type()));
        }

        out.append("type ").append(struct.structName()).append(" struct {\n");
        for (FieldDeclaration field : struct.fields()) {
            out.append('\t').append(pad(field.name(), nameWidth)).append(' ');
            if (field.tag().isEmpty()) {
                out.append(field.type());
            } else {
                out.append(pad(field.type(), typeWidth)).append(' ').append(tagLiteral(field.tag()));
            }
            out.append('\n');
        }
        out.append("}\n");
    }

    /** Raw string literal, or an interpreted one when the tag itself contains a backtick. */
    private static String tagLiteral(String tag) {
        if (tag.indexOf('`') < 0) {
            return '`' + tag + '`';
        }
        return '"' + tag.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }

    private static String pad(String value, int width) {
        return value + " ".repeat(width - width(value));
    }

    // gofmt aligns by rune, not by UTF-16 unit
    private static int width(String value) {
        return value.codePointCount(0, value.length());
    }
}
