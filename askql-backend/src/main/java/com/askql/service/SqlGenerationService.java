package com.askql.service;

import com.askql.config.EngineProperties;
import com.askql.config.GenerationProperties;
import com.askql.engine.QueryEngine;
import com.askql.engine.QueryExecutionException;
import com.askql.engine.TabularResult;
import com.askql.llm.PromptTemplates;
import com.askql.llm.SqlModelClient;
import com.askql.llm.SqlResponseExtractor;
import com.askql.model.ChatTurn;
import com.askql.model.ExecutionResult;
import com.askql.model.GenerationAttempt;
import com.askql.model.GenerationResult;
import com.askql.sql.SqlSafetyValidator;
import com.askql.sql.SqlValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a natural-language question into validated, dry-run-checked SQL.
 *
 * <p>Each attempt asks the model for SQL, extracts it from the response, passes it through
 * {@link SqlSafetyValidator} and dry-runs it on the {@link QueryEngine}. Any failure feeds the SQL
 * and error of that attempt into a retry prompt until the attempt budget is spent. Failures are
 * reported in the returned {@link GenerationResult}; this service does not throw for them.
 */
@Service
public class SqlGenerationService {

    private static final Logger log = LoggerFactory.getLogger(SqlGenerationService.class);

    static final String NO_SQL_PLACEHOLDER = "-- no SQL was extracted from the previous response";
    static final String EXTRACTION_ERROR = "Could not extract SQL from response";
    static final String DEADLINE_ERROR = "Generation deadline exceeded";
    static final String INTERRUPTED_ERROR = "Generation interrupted";

    private static final double EXPLAIN_TEMPERATURE = 0.3;
    private static final double SUGGEST_TEMPERATURE = 0.7;
    private static final double SUMMARY_TEMPERATURE = 0.3;
    private static final int MAX_SUGGESTIONS = 10;

    private static final Pattern NUMBERED_LINE = Pattern.compile("^\\s*\\d+\\s*[.)]\\s*(.+)$");

    private final SqlModelClient modelClient;
    private final SqlResponseExtractor extractor;
    private final SqlSafetyValidator validator;
    private final QueryEngine queryEngine;
    private final GenerationProperties generationProperties;
    private final EngineProperties engineProperties;
    private final Clock clock;

    /**
     * Create a new service.
     *
     * @param modelClient language model client
     * @param extractor response SQL extractor
     * @param validator safety validator
     * @param queryEngine query engine used for dry runs and execution
     * @param generationProperties retry loop settings
     * @param engineProperties engine settings (cost ceiling)
     */
    @Autowired
    public SqlGenerationService(
            SqlModelClient modelClient,
            SqlResponseExtractor extractor,
            SqlSafetyValidator validator,
            QueryEngine queryEngine,
            GenerationProperties generationProperties,
            EngineProperties engineProperties
    ) {
        this(modelClient, extractor, validator, queryEngine, generationProperties, engineProperties, Clock.systemUTC());
    }

    SqlGenerationService(
            SqlModelClient modelClient,
            SqlResponseExtractor extractor,
            SqlSafetyValidator validator,
            QueryEngine queryEngine,
            GenerationProperties generationProperties,
            EngineProperties engineProperties,
            Clock clock
    ) {
        this.modelClient = modelClient;
        this.extractor = extractor;
        this.validator = validator;
        this.queryEngine = queryEngine;
        this.generationProperties = generationProperties;
        this.engineProperties = engineProperties;
        this.clock = clock;
    }

    /**
     * Generate SQL for a question.
     *
     * @param question natural-language question
     * @param schemaContext rendered schema
     * @param history earlier turns, oldest first; may be null
     * @return result with the validated SQL, or the last SQL and error when every attempt failed
     */
    public GenerationResult generateSql(String question, String schemaContext, List<ChatTurn> history) {
        int maxRetries = Math.max(1, generationProperties.getMaxRetries());
        long deadlineMs = generationProperties.getDeadlineMs();
        long startedAt = clock.millis();

        List<GenerationAttempt> attempts = new ArrayList<>(maxRetries);
        LoopState state = LoopState.initial();

        for (int n = 1; n <= maxRetries; n++) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Text-to-SQL generation interrupted after {} attempt(s)", attempts.size());
                return GenerationResult.failure(state.lastSql(), INTERRUPTED_ERROR, attempts.size(), attempts);
            }
            if (deadlineMs > 0 && clock.millis() - startedAt >= deadlineMs) {
                log.warn("Text-to-SQL generation deadline of {} ms exceeded after {} attempt(s)", deadlineMs, attempts.size());
                return GenerationResult.failure(state.lastSql(), DEADLINE_ERROR, attempts.size(), attempts);
            }

            GenerationAttempt attempt = runAttempt(n, question, schemaContext, history, state);
            attempts.add(attempt);

            if (attempt.succeeded()) {
                log.info("Text-to-SQL generation succeeded (attempts_used={})", n);
                return GenerationResult.success(attempt.validatedSql(), n, attempts);
            }

            log.debug("Attempt {}/{} failed ({}): {}", n, maxRetries, attempt.failure(), attempt.error());
            state = state.next(attempt);
        }

        log.warn("Text-to-SQL generation failed after {} attempt(s): {}", attempts.size(), state.lastError());
        return GenerationResult.failure(state.lastSql(), state.lastError(), attempts.size(), attempts);
    }

    /**
     * Generate SQL and run it with the configured cost ceiling.
     *
     * <p>An execution failure is reported as is and does not trigger another generation round.
     *
     * @param question natural-language question
     * @param schemaContext rendered schema
     * @param history earlier turns, oldest first; may be null
     * @return execution result
     */
    public ExecutionResult generateAndExecute(String question, String schemaContext, List<ChatTurn> history) {
        GenerationResult generation = generateSql(question, schemaContext, history);
        if (!generation.success()) {
            return ExecutionResult.failure(generation.sql(), generation.error(), generation.attemptsUsed());
        }
        return execute(generation.sql(), generation.attemptsUsed());
    }

    /**
     * Run SQL that already passed generation. The SQL goes through the safety gate again before
     * it reaches the engine.
     *
     * @param sql SQL to run
     * @param attemptsUsed generation attempts to report
     * @return execution result
     */
    public ExecutionResult execute(String sql, int attemptsUsed) {
        String safeSql;
        try {
            safeSql = validator.validate(sql);
        } catch (SqlValidationException e) {
            log.warn("Refusing to execute rejected SQL: {}", e.getMessage());
            return ExecutionResult.failure(sql, e.getMessage(), attemptsUsed);
        }

        try {
            TabularResult result = queryEngine.execute(safeSql, engineProperties.getMaxBytesBilled(), false);
            log.info(
                    "Query executed (engine={}, row_count={}, truncated={}, duration_ms={})",
                    queryEngine.name(),
                    result.rowCount(),
                    result.truncated(),
                    result.durationMs()
            );
            return ExecutionResult.success(safeSql, result, attemptsUsed);
        } catch (QueryExecutionException e) {
            log.warn("Query execution failed (engine={}): {}", queryEngine.name(), e.getMessage());
            return ExecutionResult.failure(safeSql, e.getMessage(), attemptsUsed);
        }
    }

    /**
     * Ask the model to explain SQL in plain language.
     *
     * @param sql SQL to explain
     * @param question question the SQL answers; may be null
     * @return explanation text
     */
    public String explainSql(String sql, String question) {
        String prompt = PromptTemplates.buildExplanationPrompt(sql, question);
        return modelClient.generate(prompt, null, EXPLAIN_TEMPERATURE, generationProperties.getMaxTokens());
    }

    /**
     * Ask the model for a short description of a schema.
     *
     * @param schemaContext rendered schema
     * @return summary text
     */
    public String summarizeSchema(String schemaContext) {
        String prompt = PromptTemplates.buildSchemaSummaryPrompt(schemaContext);
        return modelClient.generate(prompt, null, SUMMARY_TEMPERATURE, generationProperties.getMaxTokens());
    }

    /**
     * Ask the model for example questions answerable from a schema.
     *
     * @param schemaContext rendered schema
     * @param count number of questions wanted, clamped to 1..10
     * @return at most {@code count} questions
     */
    public List<String> suggestQuestions(String schemaContext, int count) {
        int resolved = Math.max(1, Math.min(MAX_SUGGESTIONS, count));
        String prompt = PromptTemplates.buildSuggestionPrompt(schemaContext, resolved);
        String response = modelClient.generate(prompt, null, SUGGEST_TEMPERATURE, generationProperties.getMaxTokens());
        return parseNumberedList(response, resolved);
    }

    static List<String> parseNumberedList(String text, int limit) {
        List<String> out = new ArrayList<>();
        if (text == null) {
            return out;
        }
        for (String line : text.split("\\R")) {
            if (out.size() >= limit) {
                break;
            }
            Matcher m = NUMBERED_LINE.matcher(line);
            if (m.matches()) {
                String item = m.group(1).trim();
                if (!item.isEmpty()) {
                    out.add(item);
                }
            }
        }
        return out;
    }

    private GenerationAttempt runAttempt(int n, String question, String schemaContext, List<ChatTurn> history, LoopState state) {
        String dialect = generationProperties.getDialect();
        String prompt;
        double temperature;
        if (n == 1) {
            prompt = PromptTemplates.buildTextToSqlPrompt(question, schemaContext, history, dialect);
            temperature = generationProperties.getInitialTemperature();
        } else {
            String failedSql = state.lastSql() != null ? state.lastSql() : NO_SQL_PLACEHOLDER;
            prompt = PromptTemplates.buildErrorRetryPrompt(question, failedSql, state.lastError(), schemaContext);
            temperature = generationProperties.getRetryTemperature();
        }

        String raw;
        try {
            raw = modelClient.generate(
                    prompt,
                    PromptTemplates.systemInstruction(dialect),
                    temperature,
                    generationProperties.getMaxTokens()
            );
        } catch (RuntimeException e) {
            return GenerationAttempt.transportFailure(n, prompt, errorMessage(e));
        }

        Optional<String> extracted = extractor.extract(raw);
        if (extracted.isEmpty()) {
            return GenerationAttempt.extractionFailure(n, prompt, raw, EXTRACTION_ERROR);
        }
        String extractedSql = extracted.get();

        String validatedSql;
        try {
            validatedSql = validator.validate(extractedSql);
        } catch (SqlValidationException e) {
            return GenerationAttempt.validationFailure(n, prompt, raw, extractedSql, e.getMessage());
        }

        try {
            queryEngine.dryRun(validatedSql);
        } catch (RuntimeException e) {
            return GenerationAttempt.dryRunFailure(n, prompt, raw, extractedSql, validatedSql, errorMessage(e));
        }

        return GenerationAttempt.success(n, prompt, raw, extractedSql, validatedSql);
    }

    private static String errorMessage(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    /**
     * SQL and error carried from one attempt into the next.
     */
    private record LoopState(String lastSql, String lastError) {

        static LoopState initial() {
            return new LoopState(null, null);
        }

        LoopState next(GenerationAttempt failed) {
            String sql = failed.attemptedSql() != null ? failed.attemptedSql() : lastSql;
            return new LoopState(sql, failed.error());
        }
    }
}
