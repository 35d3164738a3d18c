package org.tablegen.database.sqlite;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.tablegen.config.GeneratorSettings;
import org.tablegen.database.session.JdbcCatalogSession;
import org.tablegen.model.Column;
import org.tablegen.model.Table;
import org.tablegen.model.TypeCategory;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.Statement;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Runs against a real database file through the JDBC session.
 */
class SqliteBackendTest {

    @TempDir
    Path tempDir;

    private SqliteBackend backend;

    @BeforeEach
    void setUp() throws Exception {
        Path db = tempDir.resolve("shop.db");
        try (Connection c = DriverManager.getConnection("jdbc:sqlite:" + db);
             Statement st = c.createStatement()) {
            st.execute("CREATE TABLE products (id INTEGER PRIMARY KEY AUTOINCREMENT, title VARCHAR(100) NOT NULL, price REAL)");
            st.execute("CREATE TABLE orders (id INTEGER PRIMARY KEY, product_id BIGINT, note, created_at DATETIME NOT NULL)");
            st.execute("CREATE TABLE line_items (order_id INTEGER, product_id INTEGER, qty INT, PRIMARY KEY (order_id, product_id))");
            st.execute("CREATE VIEW order_view AS SELECT * FROM orders");
        }

        GeneratorSettings settings = GeneratorSettings.builder()
                .databaseType("sqlite")
                .databaseName(db.toString())
                .build();
        backend = new SqliteBackend(settings, JdbcCatalogSession::open);
        backend.connect();
    }

    @AfterEach
    void tearDown() {
        backend.close();
    }

    private Table load(String name) {
        Table table = backend.listTables(List.of(name)).get(0);
        backend.prepareColumnFetch();
        backend.fetchColumns(table);
        return table;
    }

    @Test
    @DisplayName("뷰와 sqlite_ 내부 테이블은 제외하고 이름순으로 반환한다")
    void listsBaseTablesSorted() {
        List<Table> tables = backend.listTables(List.of());

        // AUTOINCREMENT creates sqlite_sequence
        assertThat(tables).extracting(Table::getName).containsExactly("line_items", "orders", "products");
    }

    @Test
    @DisplayName("필터는 대소문자와 무관하게 교집합만 반환한다")
    void filter() {
        List<Table> tables = backend.listTables(List.of("PRODUCTS", "Orders", "missing"));

        assertThat(tables).extracting(Table::getName).containsExactly("orders", "products");
    }

    @Test
    @DisplayName("pragma_table_info 결과를 ordinal 순서의 컬럼으로 변환한다")
    void columns() {
        Table orders = load("orders");

        assertThat(orders.getColumns())
                .extracting(Column::getOrdinalPosition, Column::getName, Column::getDataType)
                .containsExactly(
                        tuple(1, "id", "INTEGER"),
                        tuple(2, "product_id", "BIGINT"),
                        tuple(3, "note", "BLOB"),
                        tuple(4, "created_at", "DATETIME"));

        Column id = orders.getColumns().get(0);
        assertThat(backend.isPrimaryKey(id)).isTrue();
        assertThat(backend.isAutoIncrement(id)).isTrue();
        assertThat(backend.isNullable(id)).isFalse();

        assertThat(backend.isNullable(orders.getColumns().get(1))).isTrue();
        assertThat(backend.classify(orders.getColumns().get(2))).isEqualTo(TypeCategory.TEXT);
        assertThat(backend.isNullable(orders.getColumns().get(3))).isFalse();
        assertThat(backend.classify(orders.getColumns().get(3))).isEqualTo(TypeCategory.TEMPORAL);
    }

    @Test
    @DisplayName("복합 기본키의 INTEGER 컬럼은 rowid가 아니므로 auto increment가 아니다")
    void compositePrimaryKey() {
        Table items = load("line_items");

        Column orderId = items.getColumns().get(0);
        assertThat(backend.isPrimaryKey(orderId)).isTrue();
        assertThat(backend.isAutoIncrement(orderId)).isFalse();
        assertThat(backend.isPrimaryKey(items.getColumns().get(2))).isFalse();
    }

    @Test
    void classifiesDeclaredTypes() {
        Table products = load("products");

        assertThat(products.getColumns()).extracting(backend::classify)
                .containsExactly(TypeCategory.INTEGER, TypeCategory.STRING, TypeCategory.FLOAT);
        assertThat(backend.isNullable(products.getColumns().get(1))).isFalse();
        assertThat(backend.isNullable(products.getColumns().get(2))).isTrue();
    }

    @Test
    void dsnAndScopeAreTheDatabaseFile() {
        assertThat(backend.dsn()).isEqualTo("jdbc:sqlite:" + tempDir.resolve("shop.db"));
        assertThat(backend.scope()).isEqualTo(tempDir.resolve("shop.db").toString());
    }
}
