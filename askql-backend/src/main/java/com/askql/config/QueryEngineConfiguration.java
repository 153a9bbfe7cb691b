package com.askql.config;

import com.askql.engine.BigQueryQueryEngine;
import com.askql.engine.JdbcQueryEngine;
import com.askql.engine.QueryEngine;
import com.askql.schema.BigQuerySchemaContextProvider;
import com.askql.schema.JdbcSchemaContextProvider;
import com.askql.schema.SchemaContextProvider;
import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the query engine and the matching schema provider selected by {@code askql.engine.type}.
 */
@Slf4j
@Configuration
public class QueryEngineConfiguration {

    @Configuration
    @ConditionalOnProperty(prefix = "askql.engine", name = "type", havingValue = "jdbc", matchIfMissing = true)
    static class Jdbc {

        @Bean(destroyMethod = "close")
        public JdbcQueryEngine queryEngine(EngineProperties properties) {
            log.info("Query engine: jdbc (url={}, max_rows={})", properties.getJdbcUrl(), properties.getMaxRows());
            return new JdbcQueryEngine(properties);
        }

        @Bean
        public SchemaContextProvider schemaContextProvider(JdbcQueryEngine queryEngine, EngineProperties properties) {
            return new JdbcSchemaContextProvider(queryEngine.getDataSource(), properties.getDefaultDataset());
        }
    }

    @Configuration
    @ConditionalOnProperty(prefix = "askql.engine", name = "type", havingValue = "bigquery")
    static class BigQueryEngine {

        @Bean
        public BigQuery bigQuery(EngineProperties properties) {
            BigQueryOptions.Builder builder = BigQueryOptions.newBuilder();
            if (properties.getProjectId() != null && !properties.getProjectId().isBlank()) {
                builder.setProjectId(properties.getProjectId());
            }
            return builder.build().getService();
        }

        @Bean
        public QueryEngine queryEngine(BigQuery bigQuery, EngineProperties properties) {
            log.info("Query engine: bigquery (project={}, max_bytes_billed={})",
                    properties.getProjectId(), properties.getMaxBytesBilled());
            return new BigQueryQueryEngine(bigQuery, properties);
        }

        @Bean
        public SchemaContextProvider schemaContextProvider(BigQuery bigQuery, EngineProperties properties) {
            return new BigQuerySchemaContextProvider(bigQuery, properties.getProjectId(), properties.getDefaultDataset());
        }
    }
}
