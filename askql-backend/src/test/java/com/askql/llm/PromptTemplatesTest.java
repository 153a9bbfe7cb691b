package com.askql.llm;

import com.askql.model.ChatTurn;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PromptTemplatesTest {

    @Test
    void systemInstruction_statesReadOnlyAndOutputContract() {
        String s = PromptTemplates.SYSTEM_INSTRUCTION;
        assertTrue(s.contains("ONLY generate SELECT queries"));
        assertTrue(s.contains("`project.dataset.table`"));
        assertTrue(s.contains("LIMIT"));
        assertTrue(s.contains("markdown code block"));
        assertTrue(PromptTemplates.systemInstruction("PostgreSQL").contains("Use PostgreSQL SQL dialect"));
        assertEquals(s, PromptTemplates.systemInstruction(null));
    }

    @Test
    void buildTextToSqlPrompt_withoutHistory() {
        String prompt = PromptTemplates.buildTextToSqlPrompt("How many users?", "### Table: users", null);
        assertTrue(prompt.startsWith("## Database Schema\n### Table: users"));
        assertFalse(prompt.contains("## Previous Conversation"));
        assertTrue(prompt.contains("## Current Question\nHow many users?"));
        assertTrue(prompt.endsWith("Generate a BigQuery SQL query to answer this question."));
    }

    @Test
    void buildTextToSqlPrompt_replaysOnlyTheLastFiveTurnsWithSql() {
        List<ChatTurn> history = new ArrayList<>();
        for (int i = 1; i <= 7; i++) {
            history.add(new ChatTurn("q" + i, "SELECT " + i, null));
        }
        history.add(new ChatTurn("failed question", null, "Could not extract SQL from response"));

        String prompt = PromptTemplates.buildTextToSqlPrompt("next", "schema", history);

        assertFalse(prompt.contains("User: q1\n"));
        assertFalse(prompt.contains("User: q2\n"));
        assertFalse(prompt.contains("failed question"));
        for (int i = 3; i <= 7; i++) {
            assertTrue(prompt.contains("User: q" + i + "\nSQL Generated:\n```sql\nSELECT " + i + "\n```"));
        }
        assertTrue(prompt.indexOf("User: q3") < prompt.indexOf("User: q7"));
    }

    @Test
    void recentHistory_keepsOrderAndBound() {
        List<ChatTurn> history = List.of(
                new ChatTurn("a", "SELECT 1", null),
                new ChatTurn("b", null, "boom"),
                new ChatTurn("c", "SELECT 3", null)
        );
        List<ChatTurn> recent = PromptTemplates.recentHistory(history);
        assertEquals(2, recent.size());
        assertEquals("a", recent.get(0).question());
        assertEquals("c", recent.get(1).question());
        assertTrue(PromptTemplates.recentHistory(null).isEmpty());
    }

    @Test
    void buildErrorRetryPrompt_carriesFailedSqlAndError() {
        String prompt = PromptTemplates.buildErrorRetryPrompt(
                "top customers", "SELECT * FROM custmers", "Table not found: custmers", "schema");
        assertTrue(prompt.contains("## Original Question\ntop customers"));
        assertTrue(prompt.contains("## Failed SQL Query\n```sql\nSELECT * FROM custmers\n```"));
        assertTrue(prompt.contains("## Error Message\nTable not found: custmers"));
        assertTrue(prompt.endsWith("Only return the corrected SQL query in a code block, no explanations."));
    }

    @Test
    void auxiliaryPrompts() {
        assertTrue(PromptTemplates.buildExplanationPrompt("SELECT 1", "q").contains("```sql\nSELECT 1\n```"));
        assertFalse(PromptTemplates.buildExplanationPrompt("SELECT 1", null).contains("## Original Question"));
        assertTrue(PromptTemplates.buildSchemaSummaryPrompt("schema").contains("3-5 sentences"));
        assertTrue(PromptTemplates.buildSuggestionPrompt("schema", 4).contains("Suggest 4 questions"));
    }
}
