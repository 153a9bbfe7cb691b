package com.askql.sql;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqlStatementScannerTest {

    @Test
    void clean_handlesNullAndComments() {
        assertEquals("", SqlStatementScanner.clean(null));
        assertEquals("", SqlStatementScanner.clean("/* only */ -- comments"));
        assertEquals("SELECT 1", SqlStatementScanner.clean("  SELECT /* a\nmultiline */ 1  "));
    }

    @Test
    void clean_preservesWhitespaceInsideLiterals() {
        assertEquals("SELECT 'a   b' AS x", SqlStatementScanner.clean("SELECT   'a   b'   AS x"));
    }

    @Test
    void splitStatements_ignoresSemicolonsInLiterals() {
        List<String> statements = SqlStatementScanner.splitStatements("SELECT ';' AS s; SELECT 2;");
        assertEquals(List.of("SELECT ';' AS s", "SELECT 2"), statements);
    }

    @Test
    void splitStatements_handlesEscapedQuotes() {
        List<String> statements = SqlStatementScanner.splitStatements("SELECT 'it''s; fine'; SELECT 'a\\'; b'");
        assertEquals(List.of("SELECT 'it''s; fine'", "SELECT 'a\\'; b'"), statements);
    }

    @Test
    void classify_readsLeadingKeyword() {
        assertEquals(StatementKind.SELECT, SqlStatementScanner.classify("select 1").kind());
        assertEquals(StatementKind.WITH, SqlStatementScanner.classify("WITH x AS (SELECT 1) SELECT * FROM x").kind());
        assertEquals(StatementKind.SELECT, SqlStatementScanner.classify("((SELECT 1))").kind());
        assertEquals(StatementKind.INSERT, SqlStatementScanner.classify("upsert INTO t VALUES (1)").kind());
        assertEquals(StatementKind.EXECUTE, SqlStatementScanner.classify("EXEC sp_who").kind());
        assertEquals(StatementKind.UNKNOWN, SqlStatementScanner.classify("EXPLAIN SELECT 1").kind());
        assertEquals("", SqlStatementScanner.classify("42").leadingKeyword());
    }

    @Test
    void tokenize_keepsQualifiedAndQuotedNamesTogether() {
        List<String> tokens = SqlStatementScanner.tokenize("SELECT a.b FROM `p.d.t` WHERE x='y z'");
        assertEquals(List.of("SELECT", "a.b", "FROM", "`p.d.t`", "WHERE", "x", "=", "'y z'"), tokens);
    }
}
