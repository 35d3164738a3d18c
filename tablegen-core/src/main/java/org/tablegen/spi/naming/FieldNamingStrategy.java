package org.tablegen.spi.naming;

import org.tablegen.spi.naming.impl.CamelCaseNamingStrategy;
import org.tablegen.spi.naming.impl.OriginalNamingStrategy;

import java.util.Locale;

/**
 * 테이블/컬럼 이름을 Go 식별자로 변환하는 네이밍 전략
 * <p>
 * 결과는 항상 exported 식별자(대문자로 시작)이어야 합니다. struct 이름의 prefix/suffix는
 * 전략이 아니라 emitter가 붙입니다.
 *
 * @see CamelCaseNamingStrategy
 * @see OriginalNamingStrategy
 */
public interface FieldNamingStrategy {

    /**
     * 컬럼명을 필드명으로 변환합니다.
     *
     * @param columnName 컬럼명 (예: "customer_id")
     * @return 필드명 (예: "CustomerID")
     */
    String toFieldName(String columnName);

    /**
     * 테이블명을 struct 이름으로 변환합니다.
     *
     * @param tableName 테이블명 (예: "order_items")
     * @return struct 이름 (예: "OrderItems")
     */
    String toStructName(String tableName);

    /**
     * {@code --naming} 값으로 전략을 찾습니다.
     *
     * @throws IllegalArgumentException 알 수 없는 값
     */
    static FieldNamingStrategy forId(String id) {
        String key = id == null ? "" : id.trim().toLowerCase(Locale.ROOT);
        return switch (key) {
            case CamelCaseNamingStrategy.ID -> new CamelCaseNamingStrategy();
            case OriginalNamingStrategy.ID -> new OriginalNamingStrategy();
            default -> throw new IllegalArgumentException(
                    "Unknown naming '" + id + "', expected one of [camel, original]");
        };
    }
}
