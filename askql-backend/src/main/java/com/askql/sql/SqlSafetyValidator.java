package com.askql.sql;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Allow-list gate for SQL that is about to reach the query engine.
 *
 * <p>Only read-only statements pass: the declared type must be SELECT, a CTE or unknown, no blocked
 * keyword may appear as a whole word anywhere in the statement, and no danger pattern may match.
 * The checks are fail-closed. A blocked word used as a plain identifier (for example a column
 * named {@code call}) is rejected as well.
 *
 * <p>This class holds no state and is safe to share between concurrent requests.
 */
@Component
public class SqlSafetyValidator {

    static final List<String> BLOCKED_KEYWORDS = List.of(
            "INSERT",
            "UPDATE",
            "DELETE",
            "DROP",
            "CREATE",
            "ALTER",
            "TRUNCATE",
            "REPLACE",
            "MERGE",
            "GRANT",
            "REVOKE",
            "EXECUTE",
            "EXEC",
            "CALL"
    );

    private static final List<Pattern> BLOCKED_KEYWORD_PATTERNS = BLOCKED_KEYWORDS.stream()
            .map(k -> Pattern.compile("\\b" + k + "\\b", Pattern.CASE_INSENSITIVE))
            .toList();

    private static final List<Pattern> BLOCKED_PATTERNS = List.of(
            Pattern.compile("\\bINTO\\s+\\w+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bDROP\\s+(TABLE|DATABASE|SCHEMA|VIEW|INDEX)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bCREATE\\s+(TABLE|DATABASE|SCHEMA|VIEW|INDEX|FUNCTION|PROCEDURE)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bALTER\\s+(TABLE|DATABASE|SCHEMA)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bTRUNCATE\\s+TABLE", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bEXEC(UTE)?\\s*\\(", Pattern.CASE_INSENSITIVE)
    );

    private static final Set<String> TABLE_CONTEXT_KEYWORDS = Set.of(
            "FROM", "JOIN", "INNER", "LEFT", "RIGHT", "FULL", "CROSS", "OUTER"
    );

    private static final Set<String> TABLE_CONTEXT_END_KEYWORDS = Set.of(
            "WHERE", "GROUP", "ORDER", "HAVING", "LIMIT", "UNION", "QUALIFY", "WINDOW"
    );

    private static final Set<String> NON_TABLE_KEYWORDS = Set.of(
            "SELECT", "WITH", "AS", "ON", "USING", "AND", "OR", "NOT", "LATERAL", "UNNEST",
            "NATURAL", "ALL", "DISTINCT", "EXCEPT", "INTERSECT", "CASE", "WHEN", "THEN", "ELSE", "END",
            "IN", "IS", "NULL", "BY", "OFFSET", "RECURSIVE", "VALUES", "TABLESAMPLE", "FOR", "SYSTEM_TIME"
    );

    /**
     * Validate SQL and return its cleaned form.
     *
     * @param rawSql SQL text as received (may contain comments and several statements)
     * @return comment-stripped, whitespace-normalized SQL; statements are re-joined with {@code "; "}
     * @throws SqlValidationException when any statement fails a check
     */
    public String validate(String rawSql) {
        if (rawSql == null || rawSql.isBlank()) {
            throw new SqlValidationException(ValidationFailure.EMPTY_INPUT, null, "Empty SQL query", rawSql);
        }

        String cleaned = SqlStatementScanner.clean(rawSql);
        List<String> statements = SqlStatementScanner.splitStatements(cleaned);
        if (statements.isEmpty()) {
            throw new SqlValidationException(ValidationFailure.EMPTY_INPUT, null, "Empty SQL query", rawSql);
        }

        for (String text : statements) {
            validateStatement(SqlStatementScanner.classify(text), rawSql);
        }
        return String.join("; ", statements);
    }

    /**
     * Run {@link #validate(String)} without throwing.
     *
     * @param rawSql SQL text
     * @return accepted outcome with cleaned SQL, or rejected outcome with reason and message
     */
    public ValidationOutcome check(String rawSql) {
        try {
            return ValidationOutcome.accepted(validate(rawSql));
        } catch (SqlValidationException e) {
            return ValidationOutcome.rejected(e.getFailure(), e.getMessage());
        }
    }

    /**
     * Check whether SQL passes the gate.
     *
     * @param rawSql SQL text
     * @return true if {@link #validate(String)} would succeed
     */
    public boolean isValid(String rawSql) {
        return check(rawSql).accepted();
    }

    /**
     * Best-effort list of table references.
     *
     * <p>Heuristic only: a flag is raised by FROM/JOIN (and join qualifiers) and lowered by
     * WHERE/GROUP/ORDER/HAVING/LIMIT/UNION. The first name seen while the flag is raised is taken
     * as a table and its alias is skipped. Complex joins, table functions and comma joins with
     * subqueries may be under- or over-captured; do not use the result for access control.
     *
     * @param sql SQL text
     * @return distinct table references in first-seen order, quotes removed
     */
    public List<String> extractTables(String sql) {
        Set<String> tables = new LinkedHashSet<>();
        if (sql == null || sql.isBlank()) {
            return new ArrayList<>(tables);
        }

        for (String statement : SqlStatementScanner.splitStatements(SqlStatementScanner.clean(sql))) {
            collectTables(SqlStatementScanner.tokenize(statement), tables);
        }
        return new ArrayList<>(tables);
    }

    private void validateStatement(Statement statement, String rawSql) {
        if (!statement.kind().isReadOnly()) {
            throw new SqlValidationException(
                    ValidationFailure.BLOCKED_STATEMENT_TYPE,
                    statement.kind().name(),
                    "Only SELECT queries are allowed. Found: " + statement.kind().name(),
                    rawSql
            );
        }

        String text = statement.text();
        for (int i = 0; i < BLOCKED_KEYWORDS.size(); i++) {
            if (BLOCKED_KEYWORD_PATTERNS.get(i).matcher(text).find()) {
                String keyword = BLOCKED_KEYWORDS.get(i);
                throw new SqlValidationException(
                        ValidationFailure.BLOCKED_KEYWORD,
                        keyword,
                        "Dangerous operation detected: " + keyword,
                        rawSql
                );
            }
        }

        for (Pattern pattern : BLOCKED_PATTERNS) {
            Matcher m = pattern.matcher(text);
            if (m.find()) {
                throw new SqlValidationException(
                        ValidationFailure.BLOCKED_PATTERN,
                        m.group(),
                        "Potentially dangerous SQL pattern detected: " + m.group(),
                        rawSql
                );
            }
        }
    }

    private void collectTables(List<String> tokens, Set<String> tables) {
        boolean expectingTable = false;
        boolean afterTable = false;

        for (String token : tokens) {
            String upper = token.toUpperCase(Locale.ROOT);

            if (TABLE_CONTEXT_KEYWORDS.contains(upper)) {
                expectingTable = true;
                afterTable = false;
                continue;
            }
            if (TABLE_CONTEXT_END_KEYWORDS.contains(upper)) {
                expectingTable = false;
                afterTable = false;
                continue;
            }

            if (expectingTable) {
                if ("(".equals(token)) {
                    // derived table; its own FROM raises the flag again
                    expectingTable = false;
                    continue;
                }
                if (NON_TABLE_KEYWORDS.contains(upper) || !isName(token)) {
                    continue;
                }
                String name = unquote(token);
                if (!name.isEmpty()) {
                    tables.add(name);
                }
                expectingTable = false;
                afterTable = true;
                continue;
            }

            if (afterTable) {
                if (",".equals(token)) {
                    expectingTable = true;
                    afterTable = false;
                } else if (!"AS".equals(upper) && (!isName(token) || NON_TABLE_KEYWORDS.contains(upper))) {
                    afterTable = false;
                }
            }
        }
    }

    private boolean isName(String token) {
        char first = token.charAt(0);
        return Character.isLetter(first) || first == '_' || first == '`' || first == '"';
    }

    private String unquote(String token) {
        return token.replace("`", "").replace("\"", "").trim();
    }
}
