package com.askql.engine;

import com.askql.config.EngineProperties;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link QueryEngine} over a JDBC source pooled by HikariCP.
 *
 * <p>Connections are switched to read-only before use. A dry run only prepares the statement and
 * reads its result metadata, so the driver parses and resolves the query without running it. A
 * real run is capped by row count and by an estimate of the bytes returned; exceeding
 * {@code maxBytesBilled} fails the query.
 */
@Slf4j
public class JdbcQueryEngine implements QueryEngine, AutoCloseable {

    private final DataSource dataSource;
    private final EngineProperties properties;

    /**
     * Create an engine with its own connection pool.
     *
     * @param properties engine settings
     */
    public JdbcQueryEngine(EngineProperties properties) {
        this(new HikariDataSource(buildHikariConfig(properties)), properties);
    }

    /**
     * Create an engine over an existing data source.
     *
     * @param dataSource data source
     * @param properties engine settings
     */
    public JdbcQueryEngine(DataSource dataSource, EngineProperties properties) {
        this.dataSource = dataSource;
        this.properties = properties;
    }

    @Override
    public String name() {
        return "jdbc";
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    @Override
    public TabularResult execute(String sql, long maxBytesBilled, boolean dryRun) {
        if (sql == null || sql.isBlank()) {
            throw new QueryExecutionException("Query text is empty", sql);
        }
        long startTime = System.currentTimeMillis();

        try (Connection conn = dataSource.getConnection()) {
            conn.setReadOnly(true);

            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                if (dryRun) {
                    ps.getMetaData();
                    return TabularResult.dryRun(0, System.currentTimeMillis() - startTime);
                }

                int queryTimeoutMs = properties.getQueryTimeoutMs();
                if (queryTimeoutMs > 0) {
                    ps.setQueryTimeout(Math.max(1, queryTimeoutMs / 1000));
                }
                int maxRows = properties.getMaxRows();
                int fetchSize = properties.getFetchSize();
                if (maxRows > 0) {
                    // one extra row tells a capped result from an exact fit
                    int rowLimit = maxRows == Integer.MAX_VALUE ? maxRows : maxRows + 1;
                    ps.setMaxRows(rowLimit);
                    fetchSize = Math.min(fetchSize, rowLimit);
                }
                if (fetchSize > 0) {
                    ps.setFetchSize(fetchSize);
                }

                try (ResultSet rs = ps.executeQuery()) {
                    return readResult(rs, sql, maxRows, maxBytesBilled, startTime);
                }
            }
        } catch (SQLException e) {
            String prefix = dryRun ? "Dry run failed: " : "Query execution failed: ";
            log.debug("{}{} (SQLState: {}, Error Code: {})", prefix, e.getMessage(), e.getSQLState(), e.getErrorCode());
            throw new QueryExecutionException(prefix + e.getMessage(), sql, e);
        }
    }

    private TabularResult readResult(ResultSet rs, String sql, int maxRows, long maxBytesBilled, long startTime) throws SQLException {
        ResultSetMetaData rsmd = rs.getMetaData();
        int columnCount = rsmd.getColumnCount();

        List<QueryColumn> columns = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            columns.add(new QueryColumn(rsmd.getColumnLabel(i), rsmd.getColumnTypeName(i)));
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        long bytes = 0;
        boolean truncated = false;
        while (rs.next()) {
            if (maxRows > 0 && rows.size() >= maxRows) {
                truncated = true;
                break;
            }

            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= columnCount; i++) {
                Object value = JdbcValues.read(rs, i);
                bytes += JdbcValues.estimateBytes(value);
                row.put(columns.get(i - 1).name(), value);
            }
            if (maxBytesBilled > 0 && bytes > maxBytesBilled) {
                throw new QueryExecutionException(
                        "Query execution failed: result exceeded maximum bytes billed (" + maxBytesBilled + ")", sql);
            }
            rows.add(row);
        }

        return new TabularResult(columns, rows, rows.size(), truncated, System.currentTimeMillis() - startTime, bytes);
    }

    @Override
    public void close() {
        if (dataSource instanceof HikariDataSource hikari) {
            hikari.close();
        }
    }

    private static HikariConfig buildHikariConfig(EngineProperties properties) {
        HikariConfig config = new HikariConfig();
        config.setExceptionOverrideClassName(EngineSqlExceptionOverride.class.getName());
        config.setJdbcUrl(properties.getJdbcUrl());
        config.setUsername(properties.getUsername());
        config.setPassword(properties.getPassword());
        if (properties.getDriverClassName() != null && !properties.getDriverClassName().isBlank()) {
            config.setDriverClassName(properties.getDriverClassName());
        }
        config.setReadOnly(true);
        config.setConnectionTimeout(properties.getConnectionTimeoutMs());
        config.setMaximumPoolSize(properties.getMaximumPoolSize());
        config.setMinimumIdle(properties.getMinimumIdle());
        config.setPoolName("askql-engine");
        return config;
    }
}
