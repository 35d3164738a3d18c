package org.tablegen.spi.naming.impl;

import org.tablegen.spi.naming.FieldNamingStrategy;

/**
 * 원래 이름을 최대한 유지하는 네이밍 전략
 * <p>
 * 첫 글자만 대문자로 바꾸고, Go 식별자에 쓸 수 없는 문자는 {@code _}로 치환합니다.
 * 예: "customer_id" → "Customer_id", "unit-price" → "Unit_price"
 */
public class OriginalNamingStrategy implements FieldNamingStrategy {

    public static final String ID = "original";

    @Override
    public String toFieldName(String columnName) {
        return export(columnName);
    }

    @Override
    public String toStructName(String tableName) {
        return export(tableName);
    }

    private String export(String name) {
        if (name == null || name.isEmpty()) {
            return "X";
        }
        StringBuilder result = new StringBuilder(name.length() + 1);
        for (char c : name.toCharArray()) {
            result.append(Character.isLetterOrDigit(c) || c == '_' ? c : '_');
        }
        char first = result.charAt(0);
        if (Character.isLetter(first)) {
            result.setCharAt(0, Character.toUpperCase(first));
        } else {
            // digits and '_' cannot start an exported identifier
            result.insert(0, 'X');
        }
        return result.toString();
    }
}
