package com.askql.sql;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqlSafetyValidatorTest {

    private final SqlSafetyValidator validator = new SqlSafetyValidator();

    @Test
    void validate_acceptsPlainSelect() {
        String cleaned = validator.validate("SELECT * FROM users LIMIT 10");
        assertEquals("SELECT * FROM users LIMIT 10", cleaned);
    }

    @Test
    void validate_acceptsCte() {
        String sql = "WITH t AS (SELECT id FROM orders) SELECT COUNT(*) AS n FROM t";
        assertEquals(sql, validator.validate(sql));
    }

    @Test
    void validate_stripsCommentsAndCollapsesWhitespace() {
        String cleaned = validator.validate("-- top comment\nSELECT  id,\n\tname /* inline */ FROM users # trailing\n");
        assertEquals("SELECT id, name FROM users", cleaned);
    }

    @Test
    void validate_keepsCommentMarkersInsideLiterals() {
        String cleaned = validator.validate("SELECT '-- not a comment' AS s FROM t");
        assertEquals("SELECT '-- not a comment' AS s FROM t", cleaned);
    }

    @Test
    void validate_rejectsEmptyInput() {
        for (String raw : new String[]{null, "", "   ", "-- only a comment", ";;"}) {
            SqlValidationException ex = assertThrows(SqlValidationException.class, () -> validator.validate(raw));
            assertEquals(ValidationFailure.EMPTY_INPUT, ex.getFailure());
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "DELETE FROM users",
            "UPDATE users SET name = 'x'",
            "INSERT INTO users VALUES (1)",
            "DROP TABLE users",
            "TRUNCATE TABLE users",
            "MERGE INTO t USING s ON t.id = s.id WHEN MATCHED THEN DELETE",
            "GRANT SELECT ON t TO bob",
            "CALL my_proc()"
    })
    void validate_rejectsWriteStatementsByType(String sql) {
        SqlValidationException ex = assertThrows(SqlValidationException.class, () -> validator.validate(sql));
        assertEquals(ValidationFailure.BLOCKED_STATEMENT_TYPE, ex.getFailure());
        assertTrue(ex.getMessage().startsWith("Only SELECT queries are allowed. Found: "));
    }

    @ParameterizedTest
    @ValueSource(strings = {"INSERT", "UPDATE", "DELETE", "DROP", "CREATE", "ALTER", "TRUNCATE",
            "REPLACE", "MERGE", "GRANT", "REVOKE", "EXECUTE", "EXEC", "CALL"})
    void validate_rejectsBlockedKeywordAnywhere(String keyword) {
        String sql = "SELECT a FROM t WHERE b = 1 " + keyword.toLowerCase() + " x";
        SqlValidationException ex = assertThrows(SqlValidationException.class, () -> validator.validate(sql));
        assertEquals(ValidationFailure.BLOCKED_KEYWORD, ex.getFailure());
        assertEquals("Dangerous operation detected: " + keyword, ex.getMessage());
    }

    @Test
    void validate_rejectsSecondStatementOfBatch() {
        SqlValidationException ex = assertThrows(SqlValidationException.class,
                () -> validator.validate("SELECT 1; DROP TABLE users"));
        assertEquals(ValidationFailure.BLOCKED_STATEMENT_TYPE, ex.getFailure());
        assertEquals("DROP", ex.getOffending());
    }

    @Test
    void validate_rejectsSelectInto() {
        SqlValidationException ex = assertThrows(SqlValidationException.class,
                () -> validator.validate("SELECT * INTO backup FROM users"));
        assertEquals(ValidationFailure.BLOCKED_PATTERN, ex.getFailure());
        assertTrue(ex.getMessage().contains("INTO backup"));
    }

    @Test
    void validate_rejectsKeywordInsideStringLiteral() {
        assertThrows(SqlValidationException.class,
                () -> validator.validate("SELECT * FROM logs WHERE action = 'delete'"));
    }

    @Test
    void validate_allowsKeywordsAsPartOfIdentifiers() {
        String sql = "SELECT is_deleted, created_at, updated_by FROM accounts";
        assertEquals(sql, validator.validate(sql));
    }

    @Test
    void validate_allowsParenthesizedUnion() {
        String sql = "(SELECT id FROM a) UNION ALL (SELECT id FROM b)";
        assertEquals(sql, validator.validate(sql));
    }

    @Test
    void validate_isIdempotent() {
        String[] inputs = {
                "SELECT  *\nFROM users -- c\n;",
                "select 1 ; select 2",
                "WITH x AS (SELECT 1 AS a) /* c */ SELECT a FROM x"
        };
        for (String raw : inputs) {
            String once = validator.validate(raw);
            assertEquals(once, validator.validate(once));
        }
    }

    @Test
    void check_reportsFailureWithoutThrowing() {
        ValidationOutcome outcome = validator.check("DELETE FROM x");
        assertFalse(outcome.accepted());
        assertEquals(ValidationFailure.BLOCKED_STATEMENT_TYPE, outcome.failure());
        assertNull(outcome.cleanedSql());

        ValidationOutcome ok = validator.check("SELECT 1");
        assertTrue(ok.accepted());
        assertEquals("SELECT 1", ok.cleanedSql());
    }

    @Test
    void isValid_neverThrows() {
        assertFalse(validator.isValid(null));
        assertFalse(validator.isValid("DROP TABLE t"));
        assertTrue(validator.isValid("SELECT 1"));
    }

    @Test
    void extractTables_findsFromTable() {
        assertTrue(validator.extractTables("SELECT * FROM users").contains("users"));
    }

    @Test
    void extractTables_handlesJoinsAliasesAndQuotes() {
        List<String> tables = validator.extractTables(
                "SELECT o.id FROM `proj.shop.orders` AS o "
                        + "LEFT JOIN proj.shop.customers c ON c.id = o.customer_id "
                        + "WHERE o.total > 10");
        assertEquals(List.of("proj.shop.orders", "proj.shop.customers"), tables);
    }

    @Test
    void extractTables_handlesCommaJoinAndDeduplicates() {
        List<String> tables = validator.extractTables("SELECT * FROM a x, b, a WHERE x.id = b.id");
        assertEquals(List.of("a", "b"), tables);
    }

    @Test
    void extractTables_skipsDerivedTableButFindsInnerTable() {
        List<String> tables = validator.extractTables("SELECT * FROM (SELECT id FROM inner_t) sub");
        assertEquals(List.of("inner_t"), tables);
    }

    @Test
    void extractTables_returnsEmptyForBlank() {
        assertTrue(validator.extractTables("  ").isEmpty());
        assertTrue(validator.extractTables(null).isEmpty());
    }
}
