package com.askql.llm;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SqlResponseExtractorTest {

    private final SqlResponseExtractor extractor = new SqlResponseExtractor();

    @Test
    void extract_prefersSqlTaggedFence() {
        String text = "Here you go:\n```sql\nSELECT id\nFROM users\nLIMIT 5\n```\nAnything else?";
        assertEquals(Optional.of("SELECT id\nFROM users\nLIMIT 5"), extractor.extract(text));
    }

    @Test
    void extract_tagIsCaseInsensitive() {
        assertEquals(Optional.of("SELECT 1"), extractor.extract("```SQL\nSELECT 1\n```"));
    }

    @Test
    void extract_doesNotTreatSqliteTagAsSql() {
        assertEquals(Optional.of("SELECT 1"), extractor.extract("```sqlite\nSELECT 1\n```"));
    }

    @Test
    void extract_acceptsUntaggedSelectFence() {
        assertEquals(Optional.of("select count(*) from t"), extractor.extract("```\nselect count(*) from t\n```"));
    }

    @Test
    void extract_acceptsUntaggedWithFence() {
        String sql = "WITH x AS (SELECT 1 AS a)\nSELECT a FROM x";
        assertEquals(Optional.of(sql), extractor.extract("```\n" + sql + "\n```"));
    }

    @Test
    void extract_ignoresUntaggedFenceWithOtherContent() {
        assertTrue(extractor.extract("```\nDELETE FROM t\n```").isEmpty());
    }

    @Test
    void extract_fallsBackToLineScanAndDropsTerminator() {
        String text = "The query is:\nSELECT name\n  FROM users\n  WHERE active;\nThis lists active users.";
        assertEquals(Optional.of("SELECT name\n  FROM users\n  WHERE active"), extractor.extract(text));
    }

    @Test
    void extract_lineScanWithoutTerminatorTakesRest() {
        assertEquals(Optional.of("SELECT 1"), extractor.extract("SELECT 1"));
    }

    @Test
    void extract_returnsEmptyForProse() {
        assertTrue(extractor.extract("I cannot answer that with the given schema.").isEmpty());
        assertTrue(extractor.extract("").isEmpty());
        assertTrue(extractor.extract(null).isEmpty());
    }

    @Test
    void extract_lineScanRequiresWholeKeyword() {
        assertTrue(extractor.extract("Selection of data is not possible.").isEmpty());
    }
}
