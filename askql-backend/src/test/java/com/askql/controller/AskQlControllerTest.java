package com.askql.controller;

import com.askql.engine.QueryColumn;
import com.askql.llm.LlmException;
import com.askql.model.ChatTurn;
import com.askql.model.ExecutionResult;
import com.askql.model.GenerationResult;
import com.askql.service.ConversationService;
import com.askql.service.SchemaContextService;
import com.askql.service.SqlGenerationService;
import com.askql.sql.SqlSafetyValidator;
import com.askql.web.GlobalExceptionHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class AskQlControllerTest {

    private MockMvc mockMvc;
    private SqlGenerationService generationService;
    private SchemaContextService schemaContextService;
    private ConversationService conversationService;

    @BeforeEach
    void setup() {
        generationService = Mockito.mock(SqlGenerationService.class);
        schemaContextService = Mockito.mock(SchemaContextService.class);
        conversationService = new ConversationService();
        AskQlController controller = new AskQlController(
                generationService, schemaContextService, conversationService, new SqlSafetyValidator());
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
        Mockito.when(schemaContextService.resolve(any(), any(), any(), any())).thenReturn("schema");
    }

    @Test
    void generate_returnsSqlAndRecordsTurn() throws Exception {
        Mockito.when(generationService.generateSql(eq("top customers"), eq("schema"), anyList()))
                .thenReturn(GenerationResult.success("SELECT name FROM shop.customers LIMIT 10", 1, List.of()));

        mockMvc.perform(post("/v1/sql/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":\"top customers\",\"schema_context\":\"schema\",\"conversation_id\":\"c1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.sql").value("SELECT name FROM shop.customers LIMIT 10"))
                .andExpect(jsonPath("$.attempts_used").value(1))
                .andExpect(jsonPath("$.tables[0]").value("shop.customers"));

        List<ChatTurn> history = conversationService.getHistory("c1");
        assertEquals(1, history.size());
        assertEquals("SELECT name FROM shop.customers LIMIT 10", history.get(0).sql());
    }

    @Test
    void generate_usesStoredHistoryWhenNoneGiven() throws Exception {
        conversationService.recordSuccess("c2", "earlier", "SELECT 1");
        Mockito.when(generationService.generateSql(any(), any(), anyList()))
                .thenReturn(GenerationResult.failure(null, "Could not extract SQL from response", 3, List.of()));

        mockMvc.perform(post("/v1/sql/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":\"next\",\"conversation_id\":\"c2\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("Could not extract SQL from response"))
                .andExpect(jsonPath("$.attempts_used").value(3));

        Mockito.verify(generationService).generateSql("next", "schema", List.of(new ChatTurn("earlier", "SELECT 1", null)));
        assertEquals(2, conversationService.getHistory("c2").size());
        assertNull(conversationService.getHistory("c2").get(1).sql());
    }

    @Test
    void generate_rejectsBlankQuestion() throws Exception {
        mockMvc.perform(post("/v1/sql/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":\" \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"));
    }

    @Test
    void generate_missingSchemaIsInvalidArgument() throws Exception {
        Mockito.when(schemaContextService.resolve(any(), any(), any(), any()))
                .thenThrow(new IllegalArgumentException("schema_context is required (no schema provider configured)"));

        mockMvc.perform(post("/v1/sql/generate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":\"q\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));
    }

    @Test
    void ask_returnsRows() throws Exception {
        ExecutionResult result = new ExecutionResult(true, "SELECT id FROM t", List.of(new QueryColumn("id", "INT64")),
                List.of(Map.of("id", 7)), 1, false, 5, null, 1);
        Mockito.when(generationService.generateAndExecute(any(), any(), anyList())).thenReturn(result);

        mockMvc.perform(post("/v1/sql/ask")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":\"ids\",\"history\":[]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.row_count").value(1))
                .andExpect(jsonPath("$.columns[0].name").value("id"))
                .andExpect(jsonPath("$.rows[0].id").value(7));
    }

    @Test
    void validate_reportsFailureKind() throws Exception {
        mockMvc.perform(post("/v1/sql/validate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sql\":\"DELETE FROM users\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(false))
                .andExpect(jsonPath("$.failure").value("BLOCKED_STATEMENT_TYPE"))
                .andExpect(jsonPath("$.message").value("Only SELECT queries are allowed. Found: DELETE"));

        mockMvc.perform(post("/v1/sql/validate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sql\":\"SELECT *  FROM users -- all\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(true))
                .andExpect(jsonPath("$.cleaned_sql").value("SELECT * FROM users"))
                .andExpect(jsonPath("$.tables[0]").value("users"));
    }

    @Test
    void explain_mapsModelFailureToBadGateway() throws Exception {
        Mockito.when(generationService.explainSql(any(), any())).thenThrow(new LlmException("Model gateway error: HTTP 500 - x"));

        mockMvc.perform(post("/v1/sql/explain")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sql\":\"SELECT 1\"}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.code").value("AI_UNAVAILABLE"));
    }

    @Test
    void suggest_defaultsToFiveQuestions() throws Exception {
        Mockito.when(generationService.suggestQuestions("schema", 5)).thenReturn(List.of("How many orders?"));

        mockMvc.perform(post("/v1/sql/suggest")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"schema_context\":\"schema\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.questions[0]").value("How many orders?"));
    }

    @Test
    void summary_returnsText() throws Exception {
        Mockito.when(generationService.summarizeSchema("schema")).thenReturn("Orders and customers.");

        mockMvc.perform(post("/v1/schema/summary")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dataset\":\"shop\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.text").value("Orders and customers."));
    }

    @Test
    void conversations_canBeReadAndCleared() throws Exception {
        conversationService.recordSuccess("c3", "q", "SELECT 1");

        mockMvc.perform(get("/v1/conversations/c3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].question").value("q"))
                .andExpect(jsonPath("$[0].sql").value("SELECT 1"));

        mockMvc.perform(delete("/v1/conversations/c3"))
                .andExpect(status().isOk());

        assertTrue(conversationService.getHistory("c3").isEmpty());
    }
}
