package org.tablegen.spi.naming.impl;

import org.tablegen.spi.naming.FieldNamingStrategy;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 이름을 Go 스타일 카멜케이스로 변환하는 기본 네이밍 전략
 * <p>
 * 변환 예시:
 * <ul>
 *   <li>"customer_id" → "CustomerID"</li>
 *   <li>"CUSTOMER_NAME" → "CustomerName"</li>
 *   <li>"createdAt" → "CreatedAt"</li>
 *   <li>"api-key" → "APIKey"</li>
 *   <li>"2fa_code" → "X2faCode"</li>
 * </ul>
 * <p>
 * golint가 요구하는 약어(ID, URL, HTTP 등)는 전부 대문자로 씁니다.
 */
public class CamelCaseNamingStrategy implements FieldNamingStrategy {

    public static final String ID = "camel";

    private static final Set<String> INITIALISMS = Set.of(
            "ACL", "API", "ASCII", "CPU", "CSS", "DNS", "EOF", "GUID", "HTML", "HTTP", "HTTPS",
            "ID", "IP", "JSON", "LHS", "QPS", "RAM", "RHS", "RPC", "SLA", "SMTP", "SQL", "SSH",
            "TCP", "TLS", "TTL", "UDP", "UI", "UID", "UUID", "URI", "URL", "UTF8", "VM", "XML",
            "XMPP", "XSRF", "XSS"
    );

    @Override
    public String toFieldName(String columnName) {
        return toCamelCase(columnName);
    }

    @Override
    public String toStructName(String tableName) {
        return toCamelCase(tableName);
    }

    private String toCamelCase(String name) {
        StringBuilder result = new StringBuilder();
        for (String word : splitWords(name)) {
            String upper = word.toUpperCase(Locale.ROOT);
            if (INITIALISMS.contains(upper)) {
                result.append(upper);
            } else {
                result.append(Character.toUpperCase(word.charAt(0)))
                        .append(word.substring(1).toLowerCase(Locale.ROOT));
            }
        }
        if (result.length() == 0) {
            return "X";
        }
        if (!Character.isLetter(result.charAt(0))) {
            result.insert(0, 'X');
        }
        return result.toString();
    }

    /**
     * 단어 경계:
     * <ul>
     *   <li>문자/숫자가 아닌 모든 문자 (구분자는 버림)</li>
     *   <li>소문자 또는 숫자 다음의 대문자 ("createdAt" → "created", "At")</li>
     *   <li>연속된 대문자의 마지막 ("HTTPServer" → "HTTP", "Server")</li>
     * </ul>
     */
    private List<String> splitWords(String name) {
        List<String> words = new ArrayList<>();
        if (name == null) {
            return words;
        }
        char[] chars = name.toCharArray();
        StringBuilder word = new StringBuilder();
        for (int i = 0; i < chars.length; i++) {
            char current = chars[i];
            if (!Character.isLetterOrDigit(current)) {
                flush(word, words);
                continue;
            }
            if (Character.isUpperCase(current) && word.length() > 0 && startsWord(chars, i)) {
                flush(word, words);
            }
            word.append(current);
        }
        flush(word, words);
        return words;
    }

    private boolean startsWord(char[] chars, int index) {
        char prev = chars[index - 1];
        if (Character.isLowerCase(prev) || Character.isDigit(prev)) {
            return true;
        }
        return Character.isUpperCase(prev)
                && index < chars.length - 1
                && Character.isLowerCase(chars[index + 1]);
    }

    private void flush(StringBuilder word, List<String> words) {
        if (word.length() > 0) {
            words.add(word.toString());
            word.setLength(0);
        }
    }
}
