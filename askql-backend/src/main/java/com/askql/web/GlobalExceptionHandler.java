package com.askql.web;

import com.askql.api.ErrorResponse;
import com.askql.engine.QueryExecutionException;
import com.askql.llm.LlmException;
import com.askql.sql.SqlValidationException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", "Input validation failed", details);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_FAILED", "Malformed request body", ex.getMostSpecificCause().getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(IllegalArgumentException ex) {
        return respond(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), null);
    }

    @ExceptionHandler(SqlValidationException.class)
    public ResponseEntity<ErrorResponse> handleSqlValidationException(SqlValidationException ex) {
        return respond(HttpStatus.BAD_REQUEST, "SQL_REJECTED", ex.getMessage(), ex.getFailure().name());
    }

    @ExceptionHandler(LlmException.class)
    public ResponseEntity<ErrorResponse> handleLlmException(LlmException ex) {
        log.warn("Language model call failed: {}", ex.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, "AI_UNAVAILABLE", "Language model request failed", ex.getMessage());
    }

    @ExceptionHandler(QueryExecutionException.class)
    public ResponseEntity<ErrorResponse> handleQueryExecutionException(QueryExecutionException ex) {
        log.error("Query engine error occurred", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "EXECUTION_ERROR", "A query engine error occurred", ex.getMessage());
    }

    @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFoundException(Exception ex) {
        return respond(HttpStatus.NOT_FOUND, "NOT_FOUND", "Not found", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleAllExceptions(Exception ex) {
        log.error("Unhandled exception occurred", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_SERVER_ERROR", "An unexpected error occurred", ex.getMessage());
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String code, String message, String details) {
        ErrorResponse error = ErrorResponse.builder()
                .code(code)
                .message(message)
                .details(details)
                .traceId(MDC.get(TraceIdFilter.MDC_TRACE_ID))
                .build();
        return ResponseEntity.status(status).body(error);
    }
}
