package com.askql.schema;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.Statement;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JdbcSchemaContextProviderTest {

    private JdbcSchemaContextProvider provider;

    @BeforeEach
    void setUp() throws Exception {
        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:schema_" + UUID.randomUUID().toString().replace("-", "") + ";DB_CLOSE_DELAY=-1");
        dataSource.setUser("sa");
        dataSource.setPassword("");

        try (Connection conn = dataSource.getConnection();
             Statement st = conn.createStatement()) {
            st.execute("CREATE SCHEMA shop");
            st.execute("CREATE TABLE shop.orders (id INT NOT NULL PRIMARY KEY, total DECIMAL(10,2), customer_id INT)");
            st.execute("COMMENT ON TABLE shop.orders IS 'One row per order'");
            st.execute("CREATE TABLE shop.customers (id INT NOT NULL PRIMARY KEY, name VARCHAR(100))");
            st.execute("CREATE TABLE shop.order_items (id INT NOT NULL, qty INT)");
            st.execute("CREATE TABLE shop.orderxitems (secret_col VARCHAR(20))");
        }

        provider = new JdbcSchemaContextProvider(dataSource, "shop");
    }

    @Test
    void listTables_resolvesSchemaCaseInsensitively() {
        List<String> tables = provider.listTables("shop");
        assertEquals(4, tables.size());
        assertTrue(tables.containsAll(List.of("ORDERS", "CUSTOMERS", "ORDER_ITEMS", "ORDERXITEMS")));
        assertEquals(tables, provider.listTables(null));
    }

    @Test
    void describe_readsColumnsAndNullability() {
        DatasetSchema schema = provider.describe("shop", List.of("orders"));

        assertEquals("SHOP", schema.dataset());
        assertEquals(1, schema.tables().size());
        TableSchema orders = schema.tables().get(0);
        assertEquals("SHOP.ORDERS", orders.fullName());
        assertEquals("One row per order", orders.description());
        assertEquals(List.of("ID", "TOTAL", "CUSTOMER_ID"), orders.columns().stream().map(ColumnSchema::name).toList());
        assertEquals(ColumnSchema.REQUIRED, orders.columns().get(0).mode());
        assertEquals(ColumnSchema.NULLABLE, orders.columns().get(1).mode());
    }

    @Test
    void describe_rejectsUnknownTableAndDataset() {
        assertThrows(IllegalArgumentException.class, () -> provider.describe("shop", List.of("nope")));
        assertThrows(IllegalArgumentException.class, () -> provider.describe("missing", null));
    }

    @Test
    void describe_treatsUnderscoreInTableNameLiterally() {
        DatasetSchema schema = provider.describe("shop", List.of("order_items"));

        assertEquals(1, schema.tables().size());
        TableSchema items = schema.tables().get(0);
        assertEquals("ORDER_ITEMS", items.name());
        assertEquals(List.of("ID", "QTY"), items.columns().stream().map(ColumnSchema::name).toList());
    }
}
