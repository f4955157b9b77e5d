package com.marketpulse.core.session;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Retention of finished sessions, bound from {@code marketpulse.sessions.*}.
 * Checkpoints are not affected; they stay in the checkpoint store.
 */
@Component
@ConfigurationProperties(prefix = "marketpulse.sessions")
public class SessionProperties {

    /** Archived sessions kept for status queries; the oldest are evicted first. */
    private int maxArchived = 200;

    /** How long an archived session stays queryable. */
    private Duration retention = Duration.ofHours(6);

    public int getMaxArchived() { return maxArchived; }
    public void setMaxArchived(int maxArchived) { this.maxArchived = maxArchived; }

    public Duration getRetention() { return retention; }
    public void setRetention(Duration retention) { this.retention = retention; }
}
