package com.askql.schema;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders a {@link DatasetSchema} as the text block placed in prompts.
 */
@Component
public class SchemaContextRenderer {

    /**
     * Full rendering: header, one block per table with description, row count and typed columns.
     *
     * @param schema schema to render
     * @param includeRowCounts whether to print known row counts
     * @return schema context text
     */
    public String render(DatasetSchema schema, boolean includeRowCounts) {
        if (schema == null) {
            return "";
        }
        List<String> lines = new ArrayList<>();
        if (schema.project() != null && !schema.project().isBlank()) {
            lines.add("Project: " + schema.project());
        }
        lines.add("Dataset: " + schema.dataset());
        lines.add("");

        for (TableSchema table : schema.tables()) {
            lines.add("### Table: " + table.fullName());
            if (table.description() != null && !table.description().isBlank()) {
                lines.add("Description: " + table.description());
            }
            if (includeRowCounts && table.rowCount() != null && table.rowCount() > 0) {
                lines.add(String.format(Locale.US, "Row count: %,d", table.rowCount()));
            }
            lines.add("\nColumns:");
            for (ColumnSchema col : table.columns()) {
                StringBuilder sb = new StringBuilder();
                sb.append("  - `").append(col.name()).append("` (").append(col.type());
                if (!ColumnSchema.NULLABLE.equals(col.mode())) {
                    sb.append(", ").append(col.mode());
                }
                sb.append(")");
                if (col.description() != null && !col.description().isBlank()) {
                    sb.append(" - ").append(col.description());
                }
                lines.add(sb.toString());
            }
            lines.add("");
        }
        return String.join("\n", lines);
    }

    /**
     * Compact rendering: one line per table listing its column names.
     *
     * @param schema schema to render
     * @return schema context text
     */
    public String renderMinimal(DatasetSchema schema) {
        if (schema == null) {
            return "";
        }
        List<String> lines = new ArrayList<>();
        for (TableSchema table : schema.tables()) {
            List<String> columns = new ArrayList<>();
            for (ColumnSchema col : table.columns()) {
                columns.add("`" + col.name() + "`");
            }
            lines.add(table.fullName() + ": " + String.join(", ", columns));
        }
        return String.join("\n", lines);
    }
}
