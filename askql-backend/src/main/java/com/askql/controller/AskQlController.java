package com.askql.controller;

import com.askql.api.AskRequest;
import com.askql.api.AskResponse;
import com.askql.api.ExplainRequest;
import com.askql.api.GenerateSqlResponse;
import com.askql.api.SqlTextResponse;
import com.askql.api.SuggestRequest;
import com.askql.api.SuggestResponse;
import com.askql.api.ValidateSqlRequest;
import com.askql.api.ValidateSqlResponse;
import com.askql.model.ChatTurn;
import com.askql.model.ExecutionResult;
import com.askql.model.GenerationResult;
import com.askql.service.ConversationService;
import com.askql.service.SchemaContextService;
import com.askql.service.SqlGenerationService;
import com.askql.sql.SqlSafetyValidator;
import com.askql.sql.ValidationOutcome;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/v1")
public class AskQlController {

    private static final Logger log = LoggerFactory.getLogger(AskQlController.class);

    private static final int DEFAULT_SUGGESTION_COUNT = 5;

    private final SqlGenerationService generationService;
    private final SchemaContextService schemaContextService;
    private final ConversationService conversationService;
    private final SqlSafetyValidator validator;

    public AskQlController(
            SqlGenerationService generationService,
            SchemaContextService schemaContextService,
            ConversationService conversationService,
            SqlSafetyValidator validator
    ) {
        this.generationService = generationService;
        this.schemaContextService = schemaContextService;
        this.conversationService = conversationService;
        this.validator = validator;
    }

    /**
     * Generate validated SQL for a natural language question.
     *
     * POST /v1/sql/generate
     *
     * @param request question with schema source and optional history
     * @return generated SQL, or the last attempted SQL and error
     */
    @PostMapping("/sql/generate")
    public ResponseEntity<GenerateSqlResponse> generateSql(@Valid @RequestBody AskRequest request) {
        String schemaContext = resolveSchema(request);
        GenerationResult result = generationService.generateSql(request.getQuestion(), schemaContext, resolveHistory(request));
        recordTurn(request, result.success(), result.sql(), result.error());

        return ResponseEntity.ok(GenerateSqlResponse.builder()
                .success(result.success())
                .sql(result.sql())
                .error(result.error())
                .attemptsUsed(result.attemptsUsed())
                .tables(result.success() ? validator.extractTables(result.sql()) : List.of())
                .traceId(MDC.get("trace_id"))
                .build());
    }

    /**
     * Generate SQL for a question and run it.
     *
     * POST /v1/sql/ask
     *
     * @param request question with schema source and optional history
     * @return query result or error
     */
    @PostMapping("/sql/ask")
    public ResponseEntity<AskResponse> ask(@Valid @RequestBody AskRequest request) {
        String schemaContext = resolveSchema(request);
        ExecutionResult result = generationService.generateAndExecute(request.getQuestion(), schemaContext, resolveHistory(request));
        recordTurn(request, result.success(), result.sql(), result.error());

        return ResponseEntity.ok(AskResponse.builder()
                .success(result.success())
                .sql(result.sql())
                .columns(result.columns())
                .rows(result.rows())
                .rowCount(result.rowCount())
                .truncated(result.truncated())
                .durationMs(result.durationMs())
                .error(result.error())
                .attemptsUsed(result.attemptsUsed())
                .traceId(MDC.get("trace_id"))
                .build());
    }

    /**
     * Check SQL against the read-only safety rules without running it.
     *
     * POST /v1/sql/validate
     */
    @PostMapping("/sql/validate")
    public ResponseEntity<ValidateSqlResponse> validateSql(@Valid @RequestBody ValidateSqlRequest request) {
        ValidationOutcome outcome = validator.check(request.getSql());
        ValidateSqlResponse.ValidateSqlResponseBuilder builder = ValidateSqlResponse.builder()
                .valid(outcome.accepted())
                .cleanedSql(outcome.cleanedSql())
                .message(outcome.detail());
        if (outcome.accepted()) {
            builder.tables(validator.extractTables(outcome.cleanedSql()));
        } else {
            builder.failure(outcome.failure().name()).tables(List.of());
        }
        return ResponseEntity.ok(builder.build());
    }

    /**
     * Explain SQL in plain language.
     *
     * POST /v1/sql/explain
     */
    @PostMapping("/sql/explain")
    public ResponseEntity<SqlTextResponse> explainSql(@Valid @RequestBody ExplainRequest request) {
        String text = generationService.explainSql(request.getSql(), request.getQuestion());
        return ResponseEntity.ok(SqlTextResponse.builder()
                .text(text)
                .traceId(MDC.get("trace_id"))
                .build());
    }

    /**
     * Suggest questions answerable from a schema.
     *
     * POST /v1/sql/suggest
     */
    @PostMapping("/sql/suggest")
    public ResponseEntity<SuggestResponse> suggestQuestions(@Valid @RequestBody SuggestRequest request) {
        String schemaContext = schemaContextService.resolve(null, request.getSchemaContext(), request.getDataset(), request.getTables());
        int count = request.getCount() != null ? request.getCount() : DEFAULT_SUGGESTION_COUNT;
        List<String> questions = generationService.suggestQuestions(schemaContext, count);
        return ResponseEntity.ok(SuggestResponse.builder()
                .questions(questions)
                .traceId(MDC.get("trace_id"))
                .build());
    }

    /**
     * Summarize what a schema contains.
     *
     * POST /v1/schema/summary
     */
    @PostMapping("/schema/summary")
    public ResponseEntity<SqlTextResponse> summarizeSchema(@Valid @RequestBody SuggestRequest request) {
        String schemaContext = schemaContextService.resolve(null, request.getSchemaContext(), request.getDataset(), request.getTables());
        String text = generationService.summarizeSchema(schemaContext);
        return ResponseEntity.ok(SqlTextResponse.builder()
                .text(text)
                .traceId(MDC.get("trace_id"))
                .build());
    }

    /**
     * Get the recorded turns of a conversation.
     *
     * GET /v1/conversations/{conversationId}
     */
    @GetMapping("/conversations/{conversationId}")
    public ResponseEntity<List<ChatTurn>> getConversation(@PathVariable("conversationId") String conversationId) {
        return ResponseEntity.ok(conversationService.getHistory(conversationId));
    }

    /**
     * Clear a conversation.
     *
     * DELETE /v1/conversations/{conversationId}
     */
    @DeleteMapping("/conversations/{conversationId}")
    public ResponseEntity<Void> clearConversation(@PathVariable("conversationId") String conversationId) {
        conversationService.clear(conversationId);
        log.info("Conversation cleared: {}", conversationId);
        return ResponseEntity.ok().build();
    }

    private String resolveSchema(AskRequest request) {
        return schemaContextService.resolve(
                request.getQuestion(),
                request.getSchemaContext(),
                request.getDataset(),
                request.getTables()
        );
    }

    private List<ChatTurn> resolveHistory(AskRequest request) {
        if (request.getHistory() != null) {
            return request.getHistory();
        }
        return conversationService.getHistory(request.getConversationId());
    }

    private void recordTurn(AskRequest request, boolean success, String sql, String error) {
        if (request.getConversationId() == null || request.getConversationId().isBlank()) {
            return;
        }
        if (success) {
            conversationService.recordSuccess(request.getConversationId(), request.getQuestion(), sql);
        } else {
            conversationService.recordFailure(request.getConversationId(), request.getQuestion(), error);
        }
    }
}
