package com.hvacintel.consumption.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * Data sources of the estimator:
 *  - telemetry: warehouse holding one payload table per device version
 *  - operational: device roster, availability history and the indirect consumption source
 *  - results: optional ClickHouse sink, only created when a URL is configured
 */
@Configuration
@Slf4j
public class DataSourceConfig {

    @Bean
    @Primary
    @ConfigurationProperties("consumption-estimator.datasource.telemetry")
    public DataSourceProperties telemetryDataSourceProperties() {
        return new DataSourceProperties();
    }

    @Bean
    @Primary
    public DataSource telemetryDataSource(@Qualifier("telemetryDataSourceProperties") DataSourceProperties properties) {
        log.info("Telemetry data source: {}", properties.getUrl());
        return properties.initializeDataSourceBuilder().build();
    }

    @Bean
    @Primary
    public JdbcTemplate telemetryJdbcTemplate(@Qualifier("telemetryDataSource") DataSource dataSource) {
        return new JdbcTemplate(dataSource);
    }

    @Bean
    @ConfigurationProperties("consumption-estimator.datasource.operational")
    public DataSourceProperties operationalDataSourceProperties() {
        return new DataSourceProperties();
    }

    @Bean
    public DataSource operationalDataSource(@Qualifier("operationalDataSourceProperties") DataSourceProperties properties) {
        log.info("Operational data source: {}", properties.getUrl());
        return properties.initializeDataSourceBuilder().build();
    }

    @Bean
    public JdbcTemplate operationalJdbcTemplate(@Qualifier("operationalDataSource") DataSource dataSource) {
        return new JdbcTemplate(dataSource);
    }

    @Bean
    @ConfigurationProperties("consumption-estimator.datasource.results")
    @ConditionalOnProperty(prefix = "consumption-estimator.datasource.results", name = "url")
    public DataSourceProperties resultsDataSourceProperties() {
        return new DataSourceProperties();
    }

    @Bean
    @ConditionalOnProperty(prefix = "consumption-estimator.datasource.results", name = "url")
    public JdbcTemplate resultsJdbcTemplate(@Qualifier("resultsDataSourceProperties") DataSourceProperties properties) {
        log.info("Results data source: {}", properties.getUrl());
        return new JdbcTemplate(properties.initializeDataSourceBuilder().build());
    }
}
