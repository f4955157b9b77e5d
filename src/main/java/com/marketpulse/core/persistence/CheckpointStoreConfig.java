package com.marketpulse.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.time.Clock;

/**
 * Spring {@link Configuration} that provides the {@link CheckpointStore} bean.
 * <p>
 * When {@code marketpulse.checkpoint.jdbc-url} is configured, a
 * {@link JdbcCheckpointStore} persists checkpoints to PostgreSQL. Otherwise an
 * in-memory {@link InMemoryCheckpointStore} is used as a fallback -- suitable
 * for development and testing but not durable across restarts.
 */
@Configuration
public class CheckpointStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(CheckpointStoreConfig.class);

    @Bean
    @ConditionalOnProperty(prefix = "marketpulse.checkpoint", name = "jdbc-url")
    public DataSource checkpointDataSource(CheckpointProperties properties) {
        return DataSourceBuilder.create()
                .url(properties.getJdbcUrl())
                .username(properties.getUsername())
                .password(properties.getPassword())
                .build();
    }

    /**
     * JDBC-backed store, activated when a checkpoint JDBC URL is configured.
     * Creates the required database table on startup.
     */
    @Bean
    @ConditionalOnProperty(prefix = "marketpulse.checkpoint", name = "jdbc-url")
    public CheckpointStore jdbcCheckpointStore(DataSource checkpointDataSource, ObjectMapper objectMapper,
                                               Clock clock) throws SQLException {
        log.info("Configuring JDBC checkpoint store (PostgreSQL)");
        var store = new JdbcCheckpointStore(checkpointDataSource, objectMapper, clock);
        store.createTables();
        return store;
    }

    /**
     * In-memory fallback store, used when no JDBC URL is configured.
     * State is lost on application restart.
     */
    @Bean
    @ConditionalOnMissingBean(CheckpointStore.class)
    public CheckpointStore memoryCheckpointStore(ObjectMapper objectMapper, Clock clock) {
        log.info("No checkpoint database configured; using in-memory checkpoint store (state will not persist across restarts)");
        return new InMemoryCheckpointStore(objectMapper, clock);
    }
}
