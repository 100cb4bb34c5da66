package com.di.eventreplay.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;

/**
 * Builds the single HikariCP pool used by the importer together with the
 * JDBC template and transaction plumbing on top of it.
 * <p>
 * Spring Boot's DataSource auto-configuration is excluded in
 * {@link com.di.eventreplay.EventReplayApplication}; the pool settings come from
 * {@code stacks.import.datasource.*}.
 */
@Slf4j
@Configuration
public class DataSourceConfig {

    @Bean(destroyMethod = "close")
    public HikariDataSource importDataSource(ImportProperties properties) {
        ImportProperties.Datasource ds = properties.getDatasource();
        int effectiveMinIdle = Math.min(ds.getMinimumIdle(), ds.getMaximumPoolSize());

        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(ds.getJdbcUrl());
        hikariConfig.setUsername(ds.getUsername());
        hikariConfig.setPassword(ds.getPassword());
        hikariConfig.setDriverClassName(ds.getDriverClassName());
        hikariConfig.setMaximumPoolSize(ds.getMaximumPoolSize());
        hikariConfig.setMinimumIdle(effectiveMinIdle);
        hikariConfig.setIdleTimeout(ds.getIdleTimeoutMs());
        hikariConfig.setConnectionTimeout(ds.getConnectionTimeoutMs());
        hikariConfig.setMaxLifetime(ds.getMaxLifetimeMs());
        // transactions are demarcated by TransactionTemplate; REINDEX runs in auto-commit
        hikariConfig.setAutoCommit(true);
        // pool is created lazily so that a scan/reorg-only run works without a database
        hikariConfig.setInitializationFailTimeout(-1);
        if (ds.getJdbcUrl() != null && ds.getJdbcUrl().contains("postgresql")) {
            hikariConfig.addDataSourceProperty("tcpKeepAlive", "true");
            hikariConfig.addDataSourceProperty("reWriteBatchedInserts", "true");
        }
        hikariConfig.setPoolName("HikariPool-event-import");

        log.info("[POOL] Creating | url={} | user={} | maxPoolSize={}, minIdle={}",
                sanitizeUrl(ds.getJdbcUrl()), ds.getUsername(), ds.getMaximumPoolSize(), effectiveMinIdle);
        return new HikariDataSource(hikariConfig);
    }

    @Bean
    public JdbcTemplate jdbcTemplate(DataSource dataSource) {
        return new JdbcTemplate(dataSource);
    }

    @Bean
    public PlatformTransactionManager transactionManager(DataSource dataSource) {
        return new DataSourceTransactionManager(dataSource);
    }

    @Bean
    public TransactionTemplate transactionTemplate(PlatformTransactionManager transactionManager) {
        return new TransactionTemplate(transactionManager);
    }

    @Bean
    public ImportRunConfig importRunConfig(ImportProperties properties) {
        return properties.toRunConfig();
    }

    static String sanitizeUrl(String jdbcUrl) {
        if (jdbcUrl == null) {
            return "null";
        }
        return jdbcUrl.replaceAll("password=[^;&]+", "password=***");
    }
}
