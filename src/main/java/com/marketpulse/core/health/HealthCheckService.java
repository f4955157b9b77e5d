package com.marketpulse.core.health;

import com.marketpulse.core.model.ProviderCategory;
import com.marketpulse.core.model.ProviderRecord;
import com.marketpulse.core.persistence.CheckpointStore;
import com.marketpulse.core.persistence.JdbcCheckpointStore;
import com.marketpulse.core.provider.ProviderHealthRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reports the health of the checkpoint store and of each provider category.
 * <p>
 * A category is UP when all its providers are selectable, DEGRADED when some
 * are in cooldown and DOWN when none is configured or all are in cooldown.
 */
@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final CheckpointStore checkpointStore;
    private final ProviderHealthRegistry providerRegistry;

    public HealthCheckService(CheckpointStore checkpointStore, ProviderHealthRegistry providerRegistry) {
        this.checkpointStore = checkpointStore;
        this.providerRegistry = providerRegistry;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkCheckpointStore());
        List<ProviderRecord> providers = providerRegistry.snapshot();
        for (ProviderCategory category : ProviderCategory.values()) {
            results.add(checkProviders(category, providers));
        }
        return results;
    }

    private HealthStatus checkCheckpointStore() {
        if (checkpointStore instanceof JdbcCheckpointStore jdbc) {
            if (jdbc.isReachable(5)) {
                return new HealthStatus("checkpoints", HealthStatus.Status.UP,
                        "Database connection valid", Map.of("store", jdbc.describe()));
            }
            log.warn("Checkpoint store health check failed");
            return new HealthStatus("checkpoints", HealthStatus.Status.DOWN,
                    "Database connection invalid", Map.of("store", jdbc.describe()));
        }
        return new HealthStatus("checkpoints", HealthStatus.Status.UP,
                "Checkpoints kept in memory (not durable)", Map.of("store", checkpointStore.describe()));
    }

    private HealthStatus checkProviders(ProviderCategory category, List<ProviderRecord> all) {
        String component = category.key() + "-providers";
        List<ProviderRecord> providers = all.stream().filter(p -> p.category() == category).toList();
        if (providers.isEmpty()) {
            return new HealthStatus(component, HealthStatus.Status.DOWN, "No providers configured", Map.of());
        }

        Map<String, String> metadata = new LinkedHashMap<>();
        long available = 0;
        for (ProviderRecord p : providers) {
            metadata.put(p.name(), p.available() ? "available" : "disabled until " + p.disabledUntil());
            if (p.available()) {
                available++;
            }
        }

        String detail = available + "/" + providers.size() + " provider(s) available";
        if (available == providers.size()) {
            return new HealthStatus(component, HealthStatus.Status.UP, detail, metadata);
        }
        if (available == 0) {
            return new HealthStatus(component, HealthStatus.Status.DOWN, detail, metadata);
        }
        return new HealthStatus(component, HealthStatus.Status.DEGRADED, detail, metadata);
    }
}
