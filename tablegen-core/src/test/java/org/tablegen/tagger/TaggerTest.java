package org.tablegen.tagger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.tablegen.config.GeneratorSettings;
import org.tablegen.database.CatalogBackend;
import org.tablegen.database.mysql.MySqlBackend;
import org.tablegen.database.postgres.PostgresBackend;
import org.tablegen.model.Column;
import org.tablegen.testing.FixtureCatalogSession;

import static org.assertj.core.api.Assertions.assertThat;

class TaggerTest {

    private final CatalogBackend postgres = new PostgresBackend(GeneratorSettings.builder().build(), new FixtureCatalogSession());
    private final CatalogBackend mysql = new MySqlBackend(GeneratorSettings.builder().databaseType("mysql").build(), new FixtureCatalogSession());

    private static Column serialId() {
        return Column.builder()
                .name("id")
                .dataType("integer")
                .nullableFlag("NO")
                .constraintType("PRIMARY KEY")
                .defaultValue("nextval('customers_id_seq'::regclass)")
                .build();
    }

    private static Column nullableName() {
        return Column.builder().name("name").dataType("varchar").nullableFlag("YES").build();
    }

    @Test
    void db() {
        assertThat(new DbTagger().generateTag(postgres, serialId())).isEqualTo("db:\"id\"");
    }

    @Test
    @DisplayName("컬럼명의 따옴표, 역슬래시, 제어문자는 Go 문자열 규칙대로 escape 한다")
    void escapesColumnName() {
        Column odd = Column.builder().name("say \"hi\"\\now\n").dataType("varchar").nullableFlag("YES").build();

        assertThat(new DbTagger().generateTag(postgres, odd)).isEqualTo("db:\"say \\\"hi\\\"\\\\now\\n\"");
        assertThat(new JsonTagger().generateTag(postgres, odd)).isEqualTo("json:\"say \\\"hi\\\"\\\\now\\n,omitempty\"");
        assertThat(Tagger.quote("a\u0001b")).isEqualTo("\"a\\x01b\"");
    }

    @Nested
    @DisplayName("stbl")
    class Structable {

        private final StructableTagger tagger = new StructableTagger();

        @Test
        @DisplayName("기본키이면서 시퀀스 기본값이면 PRIMARY_KEY와 SERIAL,AUTO_INCREMENT가 붙는다")
        void primaryKeySerial() {
            assertThat(tagger.generateTag(postgres, serialId())).isEqualTo("stbl:\"id,PRIMARY_KEY,SERIAL,AUTO_INCREMENT\"");
        }

        @Test
        void plainColumn() {
            assertThat(tagger.generateTag(postgres, nullableName())).isEqualTo("stbl:\"name\"");
        }

        @Test
        @DisplayName("같은 컬럼이라도 backend 규칙에 따라 결과가 달라진다")
        void rulesComeFromTheBackend() {
            Column mysqlId = Column.builder().name("id").dataType("int").constraintType("PRI").extra("auto_increment").build();

            assertThat(tagger.generateTag(mysql, mysqlId)).isEqualTo("stbl:\"id,PRIMARY_KEY,SERIAL,AUTO_INCREMENT\"");
            assertThat(tagger.generateTag(postgres, mysqlId)).isEqualTo("stbl:\"id\"");
        }
    }

    @Test
    @DisplayName("json: nullable 컬럼에만 omitempty")
    void json() {
        JsonTagger tagger = new JsonTagger();

        assertThat(tagger.generateTag(postgres, nullableName())).isEqualTo("json:\"name,omitempty\"");
        assertThat(tagger.generateTag(postgres, serialId())).isEqualTo("json:\"id\"");
    }
}
