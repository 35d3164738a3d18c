package org.tablegen.database.postgres;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.tablegen.config.GeneratorSettings;
import org.tablegen.exception.ConnectionException;
import org.tablegen.exception.QueryException;
import org.tablegen.model.Column;
import org.tablegen.model.Table;
import org.tablegen.model.TypeCategory;
import org.tablegen.testing.FixtureCatalogSession;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.tablegen.testing.FixtureCatalogSession.column;
import static org.tablegen.testing.FixtureCatalogSession.with;

class PostgresBackendTest {

    private static GeneratorSettings settings() {
        return GeneratorSettings.builder().databaseName("shop").build();
    }

    private static Column typed(String dataType) {
        return Column.builder().name("c").dataType(dataType).build();
    }

    @Nested
    @DisplayName("DSN")
    class Dsn {

        @Test
        @DisplayName("호스트/포트 기본값과 sslmode가 URL에 들어간다")
        void tcpDefaults() {
            PostgresBackend backend = new PostgresBackend(settings(), new FixtureCatalogSession());

            assertThat(backend.dsn()).isEqualTo("jdbc:postgresql://127.0.0.1:5432/shop?sslmode=disable");
        }

        @Test
        @DisplayName("소켓 경로가 있으면 junixsocket 팩토리를 사용한다")
        void unixSocket() {
            GeneratorSettings s = settings();
            s.setSocket("/var/run/postgresql/.s.PGSQL.5432");
            s.setSslMode("require");

            String dsn = new PostgresBackend(s, new FixtureCatalogSession()).dsn();

            assertThat(dsn)
                    .startsWith("jdbc:postgresql://localhost/shop?socketFactory=org.newsclub.net.unix.AFUNIXSocketFactory$FactoryArg")
                    .contains("socketFactoryArg=%2Fvar%2Frun%2Fpostgresql%2F.s.PGSQL.5432")
                    .endsWith("&sslmode=require");
        }

        @Test
        @DisplayName("사용자를 지정하지 않으면 postgres로 접속한다")
        void defaultUser() {
            FixtureCatalogSession catalog = new FixtureCatalogSession();
            PostgresBackend backend = new PostgresBackend(settings(), catalog);

            backend.connect();

            assertThat(catalog.openedUser()).isEqualTo("postgres");
            assertThat(catalog.openedDriver()).isEqualTo(PostgresBackend.DRIVER);
            assertThat(catalog.openedDsn()).isEqualTo(backend.dsn());
        }

        @Test
        @DisplayName("접속 실패는 DSN을 담은 ConnectionException이 된다")
        void connectFailure() {
            PostgresBackend backend = new PostgresBackend(settings(), new FixtureCatalogSession().failConnect());

            assertThatThrownBy(backend::connect)
                    .isInstanceOf(ConnectionException.class)
                    .hasMessageContaining("Connection refused")
                    .extracting(e -> ((ConnectionException) e).getDsn())
                    .isEqualTo(backend.dsn());
        }
    }

    @Nested
    @DisplayName("listTables")
    class ListTables {

        @Test
        @DisplayName("스키마 기본값은 public이고 결과는 이름순이다")
        void defaultSchemaSorted() {
            FixtureCatalogSession catalog = new FixtureCatalogSession().withTables("products", "orders");
            PostgresBackend backend = new PostgresBackend(settings(), catalog);
            backend.connect();

            List<Table> tables = backend.listTables(List.of());

            assertThat(tables).extracting(Table::getName).containsExactly("orders", "products");
            assertThat(catalog.lastCall().args).containsExactly("public");
            assertThat(catalog.lastCall().sql)
                    .contains("table_type = 'BASE TABLE'")
                    .contains("ORDER BY table_name")
                    .doesNotContain(" IN (");
        }

        @Test
        @DisplayName("필터는 소문자로 바인딩되고 교집합만 반환된다")
        void filterIsLowerCased() {
            FixtureCatalogSession catalog = new FixtureCatalogSession().withTables("orders", "products", "users");
            GeneratorSettings s = settings();
            s.setSchema("sales");
            PostgresBackend backend = new PostgresBackend(s, catalog);
            backend.connect();

            List<Table> tables = backend.listTables(List.of("USERS", "Orders", "missing"));

            assertThat(tables).extracting(Table::getName).containsExactly("orders", "users");
            assertThat(catalog.lastCall().sql).contains("AND LOWER(table_name) IN (?, ?, ?)");
            assertThat(catalog.lastCall().args).containsExactly("sales", "users", "orders", "missing");
        }

        @Test
        @DisplayName("목록 조회 실패는 스키마를 담은 QueryException이 된다")
        void listingFailure() {
            PostgresBackend backend = new PostgresBackend(settings(), new FixtureCatalogSession().failListing());
            backend.connect();

            assertThatThrownBy(() -> backend.listTables(List.of()))
                    .isInstanceOfSatisfying(QueryException.class, e -> {
                        assertThat(e.getTable()).isNull();
                        assertThat(e.getScope()).isEqualTo("public");
                    });
        }

        @Test
        @DisplayName("connect 전에 호출하면 IllegalStateException")
        void notConnected() {
            PostgresBackend backend = new PostgresBackend(settings(), new FixtureCatalogSession());

            assertThatThrownBy(() -> backend.listTables(List.of()))
                    .isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    @DisplayName("fetchColumns")
    class FetchColumns {

        @Test
        @DisplayName("테이블명과 스키마를 바인딩하고 ordinal 순서로 컬럼을 붙인다")
        void attachesColumnsInOrdinalOrder() {
            FixtureCatalogSession catalog = new FixtureCatalogSession()
                    .withTables("customers")
                    .withColumns("customers",
                            column(2, "name", "character varying", "YES"),
                            with(with(column(1, "id", "integer", "NO"),
                                    "constraint_type", "PRIMARY KEY"),
                                    "column_default", "nextval('customers_id_seq'::regclass)"));
            PostgresBackend backend = new PostgresBackend(settings(), catalog);
            backend.connect();
            Table table = backend.listTables(List.of()).get(0);

            backend.prepareColumnFetch();
            backend.fetchColumns(table);

            assertThat(catalog.lastCall().args).containsExactly("customers", "public", "customers", "public");
            assertThat(table.getColumns()).extracting(Column::getName).containsExactly("id", "name");
            Column id = table.getColumns().get(0);
            assertThat(backend.isPrimaryKey(id)).isTrue();
            assertThat(backend.isAutoIncrement(id)).isTrue();
            assertThat(backend.isNullable(id)).isFalse();
            assertThat(backend.isNullable(table.getColumns().get(1))).isTrue();
        }

        @Test
        @DisplayName("컬럼 조회 실패는 테이블과 스키마를 담은 QueryException이 된다")
        void fetchFailure() {
            FixtureCatalogSession catalog = new FixtureCatalogSession().failColumnsOf("orders");
            PostgresBackend backend = new PostgresBackend(settings(), catalog);
            backend.connect();
            backend.prepareColumnFetch();

            assertThatThrownBy(() -> backend.fetchColumns(new Table("orders")))
                    .isInstanceOfSatisfying(QueryException.class, e -> {
                        assertThat(e.getTable()).isEqualTo("orders");
                        assertThat(e.getScope()).isEqualTo("public");
                        assertThat(e).hasMessageContaining("'orders'").hasMessageContaining("'public'");
                    });
        }

        @Test
        @DisplayName("prepareColumnFetch 없이 호출하면 IllegalStateException")
        void requiresPrepare() {
            PostgresBackend backend = new PostgresBackend(settings(), new FixtureCatalogSession());
            backend.connect();

            assertThatThrownBy(() -> backend.fetchColumns(new Table("orders")))
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("data_type이 비어 있으면 QueryException")
        void blankDataType() {
            FixtureCatalogSession catalog = new FixtureCatalogSession()
                    .withColumns("orders", column(1, "id", " ", "NO"));
            PostgresBackend backend = new PostgresBackend(settings(), catalog);
            backend.connect();
            backend.prepareColumnFetch();

            assertThatThrownBy(() -> backend.fetchColumns(new Table("orders")))
                    .isInstanceOf(QueryException.class)
                    .hasMessageContaining("no data type");
        }
    }

    @Nested
    @DisplayName("컬럼 규칙")
    class Rules {

        private final PostgresBackend backend = new PostgresBackend(settings(), new FixtureCatalogSession());

        @ParameterizedTest
        @ValueSource(strings = {"NO", "", "yes", "Y", "TRUE"})
        @DisplayName("isNullable은 정확히 YES일 때만 true")
        void nullableSentinel(String flag) {
            assertThat(backend.isNullable(Column.builder().nullableFlag(flag).build())).isFalse();
            assertThat(backend.isNullable(Column.builder().nullableFlag("YES").build())).isTrue();
            assertThat(backend.isNullable(Column.builder().build())).isFalse();
        }

        @ParameterizedTest
        @CsvSource({
                "character varying, STRING",
                "VARCHAR(100), STRING",
                "uuid, STRING",
                "text, TEXT",
                "BIGINT, INTEGER",
                "bigserial, INTEGER",
                "numeric(10), FLOAT",
                "double precision, FLOAT",
                "timestamp with time zone, TEMPORAL",
                "TIMESTAMP(6) WITHOUT TIME ZONE, TEMPORAL",
                "date, TEMPORAL",
                "jsonb, UNKNOWN",
                "boolean, UNKNOWN"
        })
        void classify(String dataType, TypeCategory expected) {
            assertThat(backend.classify(typed(dataType))).isEqualTo(expected);
        }

        @Test
        @DisplayName("목록에 있는 모든 타입은 대소문자와 무관하게 매칭된다")
        void everyListedTypeMatches() {
            backend.getStringDatatypes().forEach(t -> assertThat(backend.isString(typed(t.toUpperCase()))).as(t).isTrue());
            backend.getTextDatatypes().forEach(t -> assertThat(backend.isText(typed(t.toUpperCase()))).as(t).isTrue());
            backend.getIntegerDatatypes().forEach(t -> assertThat(backend.isInteger(typed(t.toUpperCase()))).as(t).isTrue());
            backend.getFloatDatatypes().forEach(t -> assertThat(backend.isFloat(typed(t.toUpperCase()))).as(t).isTrue());
            backend.getTemporalDatatypes().forEach(t -> assertThat(backend.isTemporal(typed(t.toUpperCase()))).as(t).isTrue());
        }

        @Test
        void primaryKeyAndSerial() {
            assertThat(backend.isPrimaryKey(Column.builder().constraintType("PRIMARY KEY").build())).isTrue();
            assertThat(backend.isPrimaryKey(Column.builder().constraintType("UNIQUE").build())).isFalse();
            assertThat(backend.isPrimaryKey(Column.builder().build())).isFalse();
            assertThat(backend.isAutoIncrement(Column.builder().defaultValue("now()").build())).isFalse();
        }
    }
}
