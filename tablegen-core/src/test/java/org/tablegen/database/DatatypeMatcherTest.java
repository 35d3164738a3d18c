package org.tablegen.database;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DatatypeMatcherTest {

    private static final List<String> TYPES = List.of("varchar", "timestamp", "double precision");

    @DisplayName("정확히 같거나 길이/수식어가 이어지는 경우만 매칭된다")
    @ParameterizedTest
    @CsvSource({
            "varchar, true",
            "VARCHAR, true",
            "VARCHAR(100), true",
            "'  varchar  ', true",
            "timestamp(6) with time zone, true",
            "DOUBLE PRECISION, true",
            "varchar2, false",
            "varcha, false",
            "double, false",
            "timestamptz, false"
    })
    void matches(String dataType, boolean expected) {
        assertThat(DatatypeMatcher.matches(dataType, TYPES)).isEqualTo(expected);
    }

    @Test
    @DisplayName("null, 빈 문자열, 빈 목록은 매칭되지 않는다")
    void blankNeverMatches() {
        assertThat(DatatypeMatcher.matches(null, TYPES)).isFalse();
        assertThat(DatatypeMatcher.matches("", TYPES)).isFalse();
        assertThat(DatatypeMatcher.matches("   ", TYPES)).isFalse();
        assertThat(DatatypeMatcher.matches("varchar", List.of())).isFalse();
    }
}
