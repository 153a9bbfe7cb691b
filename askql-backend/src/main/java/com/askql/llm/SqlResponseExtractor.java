package com.askql.llm;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls a candidate SQL string out of free-form model text.
 *
 * <p>Fenced blocks are tried first (tagged {@code sql}, then untagged blocks starting with SELECT,
 * then untagged blocks starting with WITH). Without a matching fence, the first line starting with
 * SELECT or WITH opens a capture that ends at the first line ending in {@code ;} or at a fence line. The terminator is
 * dropped. Finding nothing is a normal outcome, reported as an empty optional.
 */
@Component
public class SqlResponseExtractor {

    private static final List<Pattern> FENCE_PATTERNS = List.of(
            Pattern.compile("```sql\\b\\s*(.*?)\\s*```", Pattern.DOTALL | Pattern.CASE_INSENSITIVE),
            Pattern.compile("```\\s*(SELECT\\b.*?)\\s*```", Pattern.DOTALL | Pattern.CASE_INSENSITIVE),
            Pattern.compile("```\\s*(WITH\\b.*?)\\s*```", Pattern.DOTALL | Pattern.CASE_INSENSITIVE)
    );

    private static final Pattern SQL_LINE_START = Pattern.compile("^(SELECT|WITH)\\b", Pattern.CASE_INSENSITIVE);

    /**
     * Extract SQL from a model response.
     *
     * @param modelText raw model response
     * @return extracted SQL, or empty when none was found
     */
    public Optional<String> extract(String modelText) {
        if (modelText == null || modelText.isBlank()) {
            return Optional.empty();
        }

        for (Pattern pattern : FENCE_PATTERNS) {
            Matcher m = pattern.matcher(modelText);
            if (m.find()) {
                String sql = m.group(1).trim();
                if (!sql.isEmpty()) {
                    return Optional.of(sql);
                }
            }
        }

        return scanLines(modelText);
    }

    private Optional<String> scanLines(String modelText) {
        List<String> sqlLines = new ArrayList<>();
        boolean inSql = false;

        for (String line : modelText.strip().split("\\R")) {
            String stripped = line.strip();
            if (!inSql && SQL_LINE_START.matcher(stripped).find()) {
                inSql = true;
            }
            if (inSql) {
                if (stripped.startsWith("```")) {
                    break;
                }
                sqlLines.add(line);
                if (stripped.endsWith(";")) {
                    break;
                }
            }
        }

        if (sqlLines.isEmpty()) {
            return Optional.empty();
        }

        String sql = String.join("\n", sqlLines).strip();
        if (sql.endsWith(";")) {
            sql = sql.substring(0, sql.length() - 1).strip();
        }
        return sql.isEmpty() ? Optional.empty() : Optional.of(sql);
    }
}
