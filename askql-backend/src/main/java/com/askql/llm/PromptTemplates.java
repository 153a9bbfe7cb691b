package com.askql.llm;

import com.askql.model.ChatTurn;

import java.util.ArrayList;
import java.util.List;

/**
 * Prompt texts for text-to-SQL generation and the auxiliary model calls.
 *
 * <p>Pure formatting: no I/O and no state.
 */
public final class PromptTemplates {

    /** Number of earlier turns with SQL replayed into a new prompt. */
    public static final int HISTORY_WINDOW = 5;

    public static final String DEFAULT_DIALECT = "BigQuery";

    /** System instruction for the BigQuery dialect. */
    public static final String SYSTEM_INSTRUCTION = systemInstruction(DEFAULT_DIALECT);

    private PromptTemplates() {
    }

    /**
     * Build the system instruction for a SQL dialect.
     *
     * @param dialect dialect name, e.g. "BigQuery"
     * @return system instruction
     */
    public static String systemInstruction(String dialect) {
        String d = normalizeDialect(dialect);
        return "You are a " + d + " SQL expert assistant. Your role is to help users query their data by "
                + "generating accurate, efficient SQL queries.\n"
                + "\n"
                + "IMPORTANT RULES:\n"
                + "1. ONLY generate SELECT queries. Never generate INSERT, UPDATE, DELETE, DROP, CREATE, or any other "
                + "data-modifying statements.\n"
                + "2. Always use fully qualified table names with backticks: `project.dataset.table`\n"
                + "3. Use " + d + " SQL dialect (not MySQL, PostgreSQL, etc.)\n"
                + "4. Include appropriate LIMIT clauses to prevent excessive data retrieval\n"
                + "5. Use column aliases for clarity when using functions or expressions\n"
                + "6. Handle NULL values appropriately\n"
                + "7. For date/time operations, use " + d + "'s date functions (DATE, TIMESTAMP, EXTRACT, etc.)\n"
                + "\n"
                + "OUTPUT FORMAT:\n"
                + "- Return ONLY the SQL query in a markdown code block\n"
                + "- No explanations before or after unless specifically asked\n"
                + "- Format the SQL for readability with proper indentation\n"
                + "\n"
                + "If you cannot generate a valid SELECT query for the user's request, explain why instead of "
                + "generating unsafe SQL.";
    }

    /**
     * Build the first-attempt prompt.
     *
     * @param question user question
     * @param schemaContext rendered schema
     * @param history earlier turns, oldest first; may be null
     * @return prompt
     */
    public static String buildTextToSqlPrompt(String question, String schemaContext, List<ChatTurn> history) {
        return buildTextToSqlPrompt(question, schemaContext, history, DEFAULT_DIALECT);
    }

    public static String buildTextToSqlPrompt(String question, String schemaContext, List<ChatTurn> history, String dialect) {
        StringBuilder sb = new StringBuilder();
        sb.append("## Database Schema\n");
        sb.append(nullToEmpty(schemaContext)).append("\n\n");

        List<ChatTurn> recent = recentHistory(history);
        if (!recent.isEmpty()) {
            sb.append("## Previous Conversation\n");
            for (ChatTurn turn : recent) {
                if (turn.question() != null && !turn.question().isBlank()) {
                    sb.append("User: ").append(turn.question()).append("\n");
                }
                sb.append("SQL Generated:\n```sql\n").append(turn.sql()).append("\n```\n");
            }
            sb.append("\n");
        }

        sb.append("## Current Question\n");
        sb.append(nullToEmpty(question)).append("\n\n");
        sb.append("Generate a ").append(normalizeDialect(dialect)).append(" SQL query to answer this question.");
        return sb.toString();
    }

    /**
     * Build the prompt for a retry after a failed attempt.
     *
     * @param question original question
     * @param failedSql SQL of the failed attempt, or a placeholder when none was extracted
     * @param errorMessage failure reported for that attempt
     * @param schemaContext rendered schema
     * @return prompt
     */
    public static String buildErrorRetryPrompt(String question, String failedSql, String errorMessage, String schemaContext) {
        StringBuilder sb = new StringBuilder();
        sb.append("## Database Schema\n");
        sb.append(nullToEmpty(schemaContext)).append("\n\n");
        sb.append("## Original Question\n");
        sb.append(nullToEmpty(question)).append("\n\n");
        sb.append("## Failed SQL Query\n");
        sb.append("```sql\n").append(nullToEmpty(failedSql)).append("\n```\n\n");
        sb.append("## Error Message\n");
        sb.append(nullToEmpty(errorMessage)).append("\n\n");
        sb.append("## Task\n");
        sb.append("The above SQL query failed with the given error. Please fix the query and generate a corrected version.\n");
        sb.append("Only return the corrected SQL query in a code block, no explanations.");
        return sb.toString();
    }

    public static String buildExplanationPrompt(String sql, String question) {
        StringBuilder sb = new StringBuilder();
        if (question != null && !question.isBlank()) {
            sb.append("## Original Question\n");
            sb.append(question).append("\n\n");
        }
        sb.append("## SQL Query\n");
        sb.append("```sql\n").append(nullToEmpty(sql)).append("\n```\n\n");
        sb.append("Please explain what this SQL query does in simple terms:\n");
        sb.append("1. What tables and columns are being used?\n");
        sb.append("2. What filtering or conditions are applied?\n");
        sb.append("3. How are the results grouped or ordered?\n");
        sb.append("4. What will the output look like?\n\n");
        sb.append("Keep the explanation concise and accessible to non-technical users.");
        return sb.toString();
    }

    public static String buildSchemaSummaryPrompt(String schemaContext) {
        StringBuilder sb = new StringBuilder();
        sb.append("## Database Schema\n");
        sb.append(nullToEmpty(schemaContext)).append("\n\n");
        sb.append("Please provide a brief summary of this database schema:\n");
        sb.append("1. What kind of data does this database contain?\n");
        sb.append("2. What are the main entities/tables?\n");
        sb.append("3. What kinds of questions could be answered with this data?\n\n");
        sb.append("Keep the summary concise (3-5 sentences).");
        return sb.toString();
    }

    /**
     * Build a prompt asking for example questions answerable from the schema.
     *
     * @param schemaContext rendered schema
     * @param count number of questions wanted
     * @return prompt
     */
    public static String buildSuggestionPrompt(String schemaContext, int count) {
        StringBuilder sb = new StringBuilder();
        sb.append("## Database Schema\n");
        sb.append(nullToEmpty(schemaContext)).append("\n\n");
        sb.append("Suggest ").append(count).append(" questions a business user could ask about this data.\n");
        sb.append("Each question must be answerable with a single SELECT query over the tables above.\n");
        sb.append("Return them as a numbered list, one question per line, with no other text.");
        return sb.toString();
    }

    /**
     * Select the turns replayed into a prompt: the last {@value #HISTORY_WINDOW} turns that carry
     * SQL, oldest first.
     *
     * @param history full history, oldest first; may be null
     * @return window, never null
     */
    public static List<ChatTurn> recentHistory(List<ChatTurn> history) {
        if (history == null || history.isEmpty()) {
            return List.of();
        }
        List<ChatTurn> withSql = new ArrayList<>();
        for (ChatTurn turn : history) {
            if (turn != null && turn.hasSql()) {
                withSql.add(turn);
            }
        }
        int from = Math.max(0, withSql.size() - HISTORY_WINDOW);
        return List.copyOf(withSql.subList(from, withSql.size()));
    }

    private static String normalizeDialect(String dialect) {
        if (dialect == null || dialect.isBlank()) {
            return DEFAULT_DIALECT;
        }
        return dialect.trim();
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s.trim();
    }
}
