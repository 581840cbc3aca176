package com.di.creatormatch.config;

import com.di.creatormatch.agent.store.StoreProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * DataSource for the JDBC candidate store. DataSource auto-configuration is excluded at the
 * application level, so the connection only exists when persistence is switched on.
 */
@Configuration
@ConditionalOnProperty(name = "creatormatch.store.persistence-enabled", havingValue = "true")
public class StoreDataSourceConfig {

    @Bean
    public DataSource storeDataSource(StoreProperties properties) {
        StoreProperties.Datasource ds = properties.getDatasource();
        if (ds.getUrl() == null || ds.getUrl().isBlank()) {
            throw new IllegalStateException("creatormatch.store.datasource.url is required when persistence is enabled");
        }
        return DataSourceBuilder.create()
                .url(ds.getUrl())
                .username(ds.getUsername())
                .password(ds.getPassword())
                .driverClassName(ds.getDriverClassName())
                .build();
    }

    @Bean
    public JdbcTemplate jdbcTemplate(DataSource storeDataSource) {
        return new JdbcTemplate(storeDataSource);
    }
}
