package com.askql.schema;

import com.google.api.gax.paging.Page;
import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.DatasetId;
import com.google.cloud.bigquery.Field;
import com.google.cloud.bigquery.Schema;
import com.google.cloud.bigquery.StandardSQLTypeName;
import com.google.cloud.bigquery.StandardTableDefinition;
import com.google.cloud.bigquery.Table;
import com.google.cloud.bigquery.TableId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class BigQuerySchemaContextProviderTest {

    private BigQuery bigQuery;
    private BigQuerySchemaContextProvider provider;

    @BeforeEach
    void setUp() {
        bigQuery = mock(BigQuery.class);
        provider = new BigQuerySchemaContextProvider(bigQuery, "acme", "sales");
    }

    @Test
    @SuppressWarnings("unchecked")
    void listTables_usesDefaultDataset() {
        Table orders = mock(Table.class);
        when(orders.getTableId()).thenReturn(TableId.of("acme", "sales", "orders"));
        Page<Table> page = mock(Page.class);
        when(page.iterateAll()).thenReturn(List.of(orders));
        when(bigQuery.listTables(any(DatasetId.class))).thenReturn(page);

        assertEquals(List.of("orders"), provider.listTables(null));
        verify(bigQuery).listTables(DatasetId.of("acme", "sales"));
    }

    @Test
    void describe_readsFieldsModesAndRowCount() {
        Schema schema = Schema.of(
                Field.newBuilder("id", StandardSQLTypeName.INT64).setMode(Field.Mode.REQUIRED).build(),
                Field.newBuilder("total", StandardSQLTypeName.NUMERIC).setDescription("USD").build()
        );
        Table table = mock(Table.class);
        doReturn(StandardTableDefinition.of(schema)).when(table).getDefinition();
        when(table.getNumRows()).thenReturn(BigInteger.valueOf(42));
        when(table.getDescription()).thenReturn("Orders");
        when(bigQuery.getTable(TableId.of("acme", "sales", "orders"))).thenReturn(table);

        DatasetSchema result = provider.describe("sales", List.of("orders"));

        assertEquals("acme", result.project());
        TableSchema orders = result.tables().get(0);
        assertEquals("acme.sales.orders", orders.fullName());
        assertEquals(42L, orders.rowCount());
        assertEquals("REQUIRED", orders.columns().get(0).mode());
        assertEquals("NULLABLE", orders.columns().get(1).mode());
        assertEquals("USD", orders.columns().get(1).description());
    }

    @Test
    void describe_rejectsMissingTable() {
        assertThrows(IllegalArgumentException.class, () -> provider.describe("other.ds", List.of("nope")));
    }
}
