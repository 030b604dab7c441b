package com.hookledger.gateway;

import com.hookledger.ingest.IngestionPipeline;
import com.hookledger.ingest.PayloadValidator;
import com.hookledger.observability.MetricsRegistry;
import com.hookledger.observability.ReadinessProbe;
import com.hookledger.security.SignatureVerifier;
import com.hookledger.shared.config.HookLedgerConfig;
import com.hookledger.store.JdbcMessageStore;
import com.hookledger.store.StorageUnavailableException;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * Builds the ingestion components from the startup configuration.
 */
@Configuration
public class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    @Bean(destroyMethod = "close")
    public HikariDataSource dataSource(HookLedgerConfig config) {
        var db = config.database();
        var hikari = new HikariConfig();
        hikari.setJdbcUrl(db.url());
        hikari.setUsername(db.username());
        hikari.setPassword(db.password());
        hikari.setMaximumPoolSize(db.poolSize());
        hikari.setConnectionTimeout(db.connectionTimeoutMs());
        hikari.setPoolName("hookledger-db");
        // start even when the database is down; readiness reports it
        hikari.setInitializationFailTimeout(-1);
        return new HikariDataSource(hikari);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public JdbcMessageStore messageStore(DataSource dataSource, Clock clock, HookLedgerConfig config) {
        var store = new JdbcMessageStore(dataSource, clock, config.database().queryTimeoutSeconds());
        try {
            store.initSchema();
            log.info("Message schema ready");
        } catch (StorageUnavailableException e) {
            log.warn("Database unavailable at startup, schema will be created on first readiness check: {}",
                e.getCause().getMessage());
        }
        return store;
    }

    @Bean
    public MetricsRegistry metricsRegistry(HookLedgerConfig config) {
        return new MetricsRegistry(config.ingest().latencyBucketsMs());
    }

    @Bean
    public IngestionPipeline ingestionPipeline(JdbcMessageStore store, MetricsRegistry metrics, HookLedgerConfig config) {
        return new IngestionPipeline(
            new SignatureVerifier(),
            new PayloadValidator(config.ingest().maxTextLength()),
            store,
            metrics,
            config.secretBytes());
    }

    @Bean
    public ReadinessProbe readinessProbe(HookLedgerConfig config, JdbcMessageStore store) {
        return new ReadinessProbe(config, store);
    }
}
