package com.askql.engine;

/**
 * Tabular query engine the generated SQL runs against.
 *
 * <p>Implementations must guarantee that a dry run performs no billed work, mutates nothing and
 * returns no rows, and that a real run never scans more than {@code maxBytesBilled}.
 */
public interface QueryEngine {

    /**
     * Run or validate a query.
     *
     * @param sql query text
     * @param maxBytesBilled cost ceiling for a real run; ignored for dry runs, values &lt;= 0 disable it
     * @param dryRun validate only
     * @return rows for a real run, an empty result for a dry run
     * @throws QueryExecutionException when the engine rejects or fails the query
     */
    TabularResult execute(String sql, long maxBytesBilled, boolean dryRun);

    /**
     * Validate a query without running it.
     *
     * @param sql query text
     * @return empty result carrying the engine's byte estimate
     * @throws QueryExecutionException when the engine rejects the query
     */
    default TabularResult dryRun(String sql) {
        return execute(sql, 0, true);
    }

    /**
     * Short engine name used in logs.
     *
     * @return engine name
     */
    String name();
}
