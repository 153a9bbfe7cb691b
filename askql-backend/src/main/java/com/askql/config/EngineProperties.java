package com.askql.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Query engine settings.
 */
@Data
@ConfigurationProperties(prefix = "askql.engine")
public class EngineProperties {

    /**
     * Engine implementation:
     * - "jdbc" (default): any JDBC source through a HikariCP pool
     * - "bigquery": Google BigQuery
     */
    private String type = "jdbc";

    /** JDBC URL when type=jdbc. */
    private String jdbcUrl = "jdbc:h2:mem:askql;DB_CLOSE_DELAY=-1";

    private String username = "sa";

    private String password = "";

    /** Optional driver class; left empty, DriverManager resolves it from the URL. */
    private String driverClassName;

    private int maximumPoolSize = 5;

    private int minimumIdle = 1;

    private long connectionTimeoutMs = 10000;

    /** Per-statement timeout for real runs (JDBC) or job timeout (BigQuery). */
    private int queryTimeoutMs = 30000;

    private int fetchSize = 50;

    /** Row cap for a real run; the result is flagged truncated when hit. */
    private int maxRows = 1000;

    /** Cost ceiling applied to every real run. */
    private long maxBytesBilled = 1_000_000_000L;

    /** GCP project when type=bigquery. */
    private String projectId;

    /** Default dataset (BigQuery) or schema (JDBC) used when a request names none. */
    private String defaultDataset;
}
