package com.marketpulse.core.persistence;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Checkpoint storage configuration bound from {@code marketpulse.checkpoint.*}.
 * <p>
 * When {@code jdbc-url} is set, checkpoints go to PostgreSQL; otherwise an
 * in-memory store is used.
 */
@Component
@ConfigurationProperties(prefix = "marketpulse.checkpoint")
public class CheckpointProperties {

    private String jdbcUrl;
    private String username;
    private String password;

    public String getJdbcUrl() { return jdbcUrl; }
    public void setJdbcUrl(String jdbcUrl) { this.jdbcUrl = jdbcUrl; }

    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }

    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
}
