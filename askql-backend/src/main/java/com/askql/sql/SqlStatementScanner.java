package com.askql.sql;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Minimal SQL lexer used by the safety gate.
 *
 * <p>It understands just enough of the language to strip comments, split statements and find
 * tokens outside of string and quoted-identifier literals. It is not a parser: statement bodies are
 * never interpreted beyond their leading keyword.
 */
public final class SqlStatementScanner {

    private SqlStatementScanner() {
    }

    /**
     * Remove comments and collapse whitespace runs outside literals.
     *
     * @param sql raw SQL text, may be null
     * @return cleaned SQL, trimmed (empty when nothing remains)
     */
    public static String clean(String sql) {
        if (sql == null) {
            return "";
        }

        int len = sql.length();
        StringBuilder out = new StringBuilder(len);
        boolean pendingSpace = false;
        int i = 0;
        while (i < len) {
            char c = sql.charAt(i);

            if (c == '-' && i + 1 < len && sql.charAt(i + 1) == '-' || c == '#') {
                i = skipLineComment(sql, i);
                pendingSpace = true;
                continue;
            }
            if (c == '/' && i + 1 < len && sql.charAt(i + 1) == '*') {
                i = skipBlockComment(sql, i);
                pendingSpace = true;
                continue;
            }
            if (Character.isWhitespace(c)) {
                pendingSpace = true;
                i++;
                continue;
            }

            if (pendingSpace && out.length() > 0) {
                out.append(' ');
            }
            pendingSpace = false;

            if (isQuote(c)) {
                int end = skipQuoted(sql, i);
                out.append(sql, i, end);
                i = end;
                continue;
            }

            out.append(c);
            i++;
        }
        return out.toString();
    }

    /**
     * Split cleaned SQL on statement terminators that are outside literals.
     *
     * @param sql SQL text (normally the output of {@link #clean(String)})
     * @return non-empty statement texts, trimmed, without terminators
     */
    public static List<String> splitStatements(String sql) {
        List<String> out = new ArrayList<>();
        if (sql == null || sql.isBlank()) {
            return out;
        }

        int len = sql.length();
        int start = 0;
        int i = 0;
        while (i < len) {
            char c = sql.charAt(i);
            if (isQuote(c)) {
                i = skipQuoted(sql, i);
                continue;
            }
            if (c == ';') {
                addIfNotBlank(out, sql.substring(start, i));
                start = i + 1;
            }
            i++;
        }
        addIfNotBlank(out, sql.substring(start));
        return out;
    }

    /**
     * Classify one statement by its leading keyword. Leading parentheses are skipped so that
     * {@code (SELECT ...) UNION ALL (SELECT ...)} is seen as a SELECT.
     *
     * @param statementText single statement text
     * @return classified statement
     */
    public static Statement classify(String statementText) {
        String text = statementText == null ? "" : statementText.trim();
        int len = text.length();
        int i = 0;
        while (i < len && (Character.isWhitespace(text.charAt(i)) || text.charAt(i) == '(')) {
            i++;
        }
        int start = i;
        while (i < len && (Character.isLetter(text.charAt(i)) || text.charAt(i) == '_')) {
            i++;
        }
        String keyword = text.substring(start, i).toUpperCase(Locale.ROOT);
        return new Statement(keyword, StatementKind.fromKeyword(keyword), text);
    }

    /**
     * Break a statement into tokens. Names (including dotted and quoted parts written without
     * whitespace between them) form one token, string literals form one token, and every other
     * non-whitespace character is its own token.
     *
     * @param sql statement text
     * @return tokens in source order
     */
    public static List<String> tokenize(String sql) {
        List<String> tokens = new ArrayList<>();
        if (sql == null) {
            return tokens;
        }

        int len = sql.length();
        int i = 0;
        while (i < len) {
            char c = sql.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }
            if (c == '\'') {
                int end = skipQuoted(sql, i);
                tokens.add(sql.substring(i, end));
                i = end;
                continue;
            }
            if (isNameChar(c) || c == '`' || c == '"') {
                int start = i;
                while (i < len) {
                    char ch = sql.charAt(i);
                    if (ch == '`' || ch == '"') {
                        i = skipQuoted(sql, i);
                    } else if (isNameChar(ch)) {
                        i++;
                    } else {
                        break;
                    }
                }
                tokens.add(sql.substring(start, i));
                continue;
            }
            tokens.add(String.valueOf(c));
            i++;
        }
        return tokens;
    }

    private static void addIfNotBlank(List<String> out, String fragment) {
        String trimmed = fragment.trim();
        if (!trimmed.isEmpty()) {
            out.add(trimmed);
        }
    }

    private static boolean isQuote(char c) {
        return c == '\'' || c == '"' || c == '`';
    }

    private static boolean isNameChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == '$' || c == '@';
    }

    /**
     * Returns the index just past the literal starting at {@code start}. Doubled quotes and
     * backslash escapes are honored; an unterminated literal runs to the end of the input.
     */
    private static int skipQuoted(String sql, int start) {
        char quote = sql.charAt(start);
        int len = sql.length();
        int i = start + 1;
        while (i < len) {
            char c = sql.charAt(i);
            if (c == '\\' && quote != '`') {
                i += 2;
                continue;
            }
            if (c == quote) {
                if (i + 1 < len && sql.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return len;
    }

    private static int skipLineComment(String sql, int start) {
        int end = sql.indexOf('\n', start);
        return end < 0 ? sql.length() : end + 1;
    }

    private static int skipBlockComment(String sql, int start) {
        int end = sql.indexOf("*/", start + 2);
        return end < 0 ? sql.length() : end + 2;
    }
}
