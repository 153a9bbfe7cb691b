package com.askql.schema;

import com.askql.engine.QueryExecutionException;
import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * {@link SchemaContextProvider} reading JDBC {@link DatabaseMetaData}.
 *
 * <p>Schema names are tried as given, then upper-cased, then lower-cased, since drivers differ
 * in how they store unquoted identifiers (H2 and Oracle upper-case, PostgreSQL lower-case).
 */
@Slf4j
public class JdbcSchemaContextProvider implements SchemaContextProvider {

    // H2 2.x reports plain tables as "BASE TABLE"
    private static final String[] TABLE_TYPES = {"TABLE", "BASE TABLE", "VIEW"};

    private final DataSource dataSource;
    private final String defaultSchema;

    public JdbcSchemaContextProvider(DataSource dataSource, String defaultSchema) {
        this.dataSource = dataSource;
        this.defaultSchema = defaultSchema;
    }

    @Override
    public List<String> listTables(String dataset) {
        try (Connection conn = dataSource.getConnection()) {
            DatabaseMetaData md = conn.getMetaData();
            String schema = resolveSchema(md, dataset);
            return readTableNames(md, schema);
        } catch (SQLException e) {
            throw new QueryExecutionException("Failed to list tables: " + e.getMessage(), null, e);
        }
    }

    @Override
    public DatasetSchema describe(String dataset, List<String> tables) {
        try (Connection conn = dataSource.getConnection()) {
            DatabaseMetaData md = conn.getMetaData();
            String schema = resolveSchema(md, dataset);
            String catalog = conn.getCatalog();

            List<String> names = readTableNames(md, schema);
            if (tables != null && !tables.isEmpty()) {
                names = filterTables(names, tables);
            }

            List<TableSchema> result = new ArrayList<>(names.size());
            for (String name : names) {
                result.add(describeTable(md, schema, name));
            }
            log.debug("Described {} table(s) in schema {}", result.size(), schema);
            return new DatasetSchema(catalog, schema, result);
        } catch (SQLException e) {
            throw new QueryExecutionException("Failed to read schema: " + e.getMessage(), null, e);
        }
    }

    private String resolveSchema(DatabaseMetaData md, String dataset) throws SQLException {
        String requested = dataset != null && !dataset.isBlank() ? dataset.trim() : defaultSchema;
        if (requested == null || requested.isBlank()) {
            requested = "PUBLIC";
        }
        for (String candidate : new String[]{requested, requested.toUpperCase(Locale.ROOT), requested.toLowerCase(Locale.ROOT)}) {
            try (ResultSet rs = md.getSchemas(null, escape(md, candidate))) {
                while (rs.next()) {
                    String found = rs.getString("TABLE_SCHEM");
                    if (candidate.equals(found)) {
                        return found;
                    }
                }
            }
        }
        throw new IllegalArgumentException("Dataset not found: " + requested);
    }

    private List<String> readTableNames(DatabaseMetaData md, String schema) throws SQLException {
        List<String> names = new ArrayList<>();
        try (ResultSet rs = md.getTables(null, escape(md, schema), "%", TABLE_TYPES)) {
            while (rs.next()) {
                if (schema.equals(rs.getString("TABLE_SCHEM"))) {
                    names.add(rs.getString("TABLE_NAME"));
                }
            }
        }
        return names;
    }

    private List<String> filterTables(List<String> available, List<String> requested) {
        Set<String> wanted = new LinkedHashSet<>();
        for (String r : requested) {
            if (r == null || r.isBlank()) {
                continue;
            }
            String match = null;
            for (String name : available) {
                if (name.equalsIgnoreCase(r.trim())) {
                    match = name;
                    break;
                }
            }
            if (match == null) {
                throw new IllegalArgumentException("Table not found: " + r.trim());
            }
            wanted.add(match);
        }
        return new ArrayList<>(wanted);
    }

    private TableSchema describeTable(DatabaseMetaData md, String schema, String table) throws SQLException {
        String description = null;
        String schemaPattern = escape(md, schema);
        String tablePattern = escape(md, table);
        try (ResultSet rs = md.getTables(null, schemaPattern, tablePattern, TABLE_TYPES)) {
            while (rs.next()) {
                if (isSameTable(rs, schema, table)) {
                    description = rs.getString("REMARKS");
                    break;
                }
            }
        }

        List<ColumnSchema> columns = new ArrayList<>();
        try (ResultSet rs = md.getColumns(null, schemaPattern, tablePattern, "%")) {
            while (rs.next()) {
                if (!isSameTable(rs, schema, table)) {
                    continue;
                }
                String mode = rs.getInt("NULLABLE") == DatabaseMetaData.columnNoNulls
                        ? ColumnSchema.REQUIRED
                        : ColumnSchema.NULLABLE;
                columns.add(new ColumnSchema(
                        rs.getString("COLUMN_NAME"),
                        rs.getString("TYPE_NAME"),
                        mode,
                        rs.getString("REMARKS")
                ));
            }
        }
        return new TableSchema(table, schema + "." + table, description, null, columns);
    }

    // Metadata lookups take LIKE patterns; '_' and '%' in real names must not match other objects.
    private static String escape(DatabaseMetaData md, String name) throws SQLException {
        String esc = md.getSearchStringEscape();
        if (name == null || esc == null || esc.isEmpty()) {
            return name;
        }
        return name.replace(esc, esc + esc)
                .replace("_", esc + "_")
                .replace("%", esc + "%");
    }

    private static boolean isSameTable(ResultSet rs, String schema, String table) throws SQLException {
        return schema.equals(rs.getString("TABLE_SCHEM")) && table.equals(rs.getString("TABLE_NAME"));
    }
}
