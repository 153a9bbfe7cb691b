package com.askql.sql;

import java.util.Locale;
import java.util.Map;

/**
 * Declared type of a single SQL statement, derived from its leading keyword.
 */
public enum StatementKind {
    SELECT(true),
    WITH(true),
    UNKNOWN(true),
    INSERT(false),
    UPDATE(false),
    DELETE(false),
    MERGE(false),
    REPLACE(false),
    CREATE(false),
    DROP(false),
    ALTER(false),
    TRUNCATE(false),
    GRANT(false),
    REVOKE(false),
    CALL(false),
    EXECUTE(false);

    private static final Map<String, StatementKind> BY_KEYWORD = Map.ofEntries(
            Map.entry("SELECT", SELECT),
            Map.entry("WITH", WITH),
            Map.entry("INSERT", INSERT),
            Map.entry("UPDATE", UPDATE),
            Map.entry("DELETE", DELETE),
            Map.entry("MERGE", MERGE),
            Map.entry("REPLACE", REPLACE),
            Map.entry("UPSERT", INSERT),
            Map.entry("CREATE", CREATE),
            Map.entry("DROP", DROP),
            Map.entry("ALTER", ALTER),
            Map.entry("TRUNCATE", TRUNCATE),
            Map.entry("GRANT", GRANT),
            Map.entry("REVOKE", REVOKE),
            Map.entry("CALL", CALL),
            Map.entry("EXECUTE", EXECUTE),
            Map.entry("EXEC", EXECUTE)
    );

    private final boolean readOnly;

    StatementKind(boolean readOnly) {
        this.readOnly = readOnly;
    }

    /**
     * Whether statements of this kind may pass the safety gate on their declared type alone.
     *
     * @return true for SELECT, WITH and UNKNOWN
     */
    public boolean isReadOnly() {
        return readOnly;
    }

    /**
     * Map a leading keyword to a statement kind.
     *
     * @param keyword leading keyword (any case), may be null
     * @return matching kind, {@link #UNKNOWN} when the keyword is not recognized
     */
    public static StatementKind fromKeyword(String keyword) {
        if (keyword == null || keyword.isBlank()) {
            return UNKNOWN;
        }
        return BY_KEYWORD.getOrDefault(keyword.trim().toUpperCase(Locale.ROOT), UNKNOWN);
    }
}
