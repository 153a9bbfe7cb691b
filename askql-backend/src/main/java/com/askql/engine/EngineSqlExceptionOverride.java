package com.askql.engine;

import com.zaxxer.hikari.SQLExceptionOverride;

import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.SQLSyntaxErrorException;

/**
 * Keeps pooled connections alive when a query is rejected for its content.
 *
 * <p>Generated SQL is expected to fail dry runs regularly (unknown columns, bad syntax). Those
 * errors say nothing about the connection and must not evict it from the pool.
 */
public class EngineSqlExceptionOverride implements SQLExceptionOverride {

    /**
     * Decide whether Hikari should evict a connection based on the exception.
     *
     * @param sqlException SQL exception
     * @return override decision
     */
    @java.lang.Override
    public SQLExceptionOverride.Override adjudicate(SQLException sqlException) {
        if (sqlException == null) {
            return Override.CONTINUE_EVICT;
        }
        if (sqlException instanceof SQLSyntaxErrorException || sqlException instanceof SQLFeatureNotSupportedException) {
            return Override.DO_NOT_EVICT;
        }

        String sqlState = sqlException.getSQLState();
        if (sqlState == null) {
            return Override.CONTINUE_EVICT;
        }
        // 42: syntax error or access rule violation, 22: data exception, 0A: feature not supported
        if (sqlState.startsWith("42") || sqlState.startsWith("22") || sqlState.startsWith("0A")) {
            return Override.DO_NOT_EVICT;
        }
        return Override.CONTINUE_EVICT;
    }
}
