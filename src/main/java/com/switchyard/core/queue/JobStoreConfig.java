package com.switchyard.core.queue;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.sql.SQLException;

/**
 * Provides the {@link JobStore} for the offline queue.
 * <p>
 * With {@code switchyard.queue.store=jdbc} (the {@code jdbc} profile) jobs are kept in
 * PostgreSQL. Otherwise they are written as JSON files under
 * {@code switchyard.queue.directory}.
 */
@Configuration
public class JobStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(JobStoreConfig.class);

    @Bean
    @ConditionalOnProperty(name = "switchyard.queue.store", havingValue = "jdbc")
    public JobStore jdbcJobStore(DataSource dataSource, ObjectMapper objectMapper) throws SQLException {
        log.info("Configuring JDBC job store (PostgreSQL)");
        var store = new JdbcJobStore(dataSource, objectMapper);
        store.createTables();
        return store;
    }

    @Bean
    @ConditionalOnMissingBean(JobStore.class)
    public JobStore fileJobStore(QueueProperties properties, ObjectMapper objectMapper) {
        log.info("Configuring file job store in {}", properties.getDirectory());
        var store = new FileJobStore(Path.of(properties.getDirectory()), objectMapper);
        store.load();
        return store;
    }
}
