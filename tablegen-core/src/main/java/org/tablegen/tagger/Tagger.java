package org.tablegen.tagger;

import org.tablegen.database.CatalogBackend;
import org.tablegen.model.Column;

/**
 * Produces one struct tag fragment, such as {@code db:"customer_id"}, for a generated field.
 * Implementations are stateless; the backend is passed in for product-specific column rules.
 */
@FunctionalInterface
public interface Tagger {

    String generateTag(CatalogBackend backend, Column column);

    /**
     * Go double-quoted form of a tag value. reflect.StructTag unquotes values with
     * strconv.Unquote, so quotes, backslashes and control characters are escaped.
     */
    static String quote(String value) {
        StringBuilder out = new StringBuilder(value.length() + 2).append('"');
        for (char c : value.toCharArray()) {
            switch (c) {
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                default -> {
                    if (c < 0x20 || c == 0x7f) {
                        out.append(String.format("\\x%02x", (int) c));
                    } else {
                        out.append(c);
                    }
                }
            }
        }
        return out.append('"').toString();
    }
}
