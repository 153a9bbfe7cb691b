package com.askql.service;

import com.askql.config.GenerationProperties;
import com.askql.schema.DatasetSchema;
import com.askql.schema.SchemaContextProvider;
import com.askql.schema.SchemaContextRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Resolves the schema context text placed in prompts.
 *
 * <p>Explicit context text wins. Otherwise the configured {@link SchemaContextProvider} describes
 * the requested dataset. When no tables are named, only tables whose names appear in the question
 * are described, falling back to the whole dataset. A rendering longer than
 * {@code askql.generation.max-schema-context-chars} is replaced by the compact one-line-per-table form.
 */
@Service
public class SchemaContextService {

    private static final Logger log = LoggerFactory.getLogger(SchemaContextService.class);

    private final ObjectProvider<SchemaContextProvider> providers;
    private final SchemaContextRenderer renderer;
    private final GenerationProperties generationProperties;

    public SchemaContextService(
            ObjectProvider<SchemaContextProvider> providers,
            SchemaContextRenderer renderer,
            GenerationProperties generationProperties
    ) {
        this.providers = providers;
        this.renderer = renderer;
        this.generationProperties = generationProperties;
    }

    /**
     * Resolve schema context for a question.
     *
     * @param question user question, used to narrow the table list; may be null
     * @param schemaContext explicit context text; may be null
     * @param dataset dataset to describe when no context text is given
     * @param tables tables to describe; null or empty selects tables relevant to the question
     * @return schema context text
     * @throws IllegalArgumentException when neither context text nor a describable dataset is given
     */
    public String resolve(String question, String schemaContext, String dataset, List<String> tables) {
        if (schemaContext != null && !schemaContext.isBlank()) {
            return schemaContext.trim();
        }

        SchemaContextProvider provider = providers.getIfAvailable();
        if (provider == null) {
            throw new IllegalArgumentException("schema_context is required (no schema provider configured)");
        }

        List<String> selected = tables;
        if ((selected == null || selected.isEmpty()) && question != null && !question.isBlank()) {
            selected = relevantTables(question, provider.listTables(dataset));
        }

        DatasetSchema schema = provider.describe(dataset, selected);
        if (schema.tables().isEmpty()) {
            throw new IllegalArgumentException("No tables found for dataset: " + schema.dataset());
        }
        log.debug("Resolved schema context for dataset {} ({} table(s))", schema.dataset(), schema.tables().size());
        String rendered = renderer.render(schema, true);
        int limit = generationProperties.getMaxSchemaContextChars();
        if (limit > 0 && rendered.length() > limit) {
            log.info("Schema context too large ({} chars, limit={}), using compact form", rendered.length(), limit);
            return renderer.renderMinimal(schema);
        }
        return rendered;
    }

    /**
     * Pick the tables whose names (singular or plural) occur in the question.
     *
     * @param question user question
     * @param allTables candidate tables
     * @return matching tables, or all tables when none match
     */
    static List<String> relevantTables(String question, List<String> allTables) {
        String q = question.toLowerCase(Locale.ROOT);
        List<String> relevant = new ArrayList<>();
        for (String table : allTables) {
            String t = table.toLowerCase(Locale.ROOT);
            if (q.contains(t)
                    || (t.length() > 1 && t.endsWith("s") && q.contains(t.substring(0, t.length() - 1)))
                    || q.contains(t + "s")) {
                relevant.add(table);
            }
        }
        return relevant.isEmpty() ? allTables : relevant;
    }
}
