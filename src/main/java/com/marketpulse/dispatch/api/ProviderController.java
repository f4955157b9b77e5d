package com.marketpulse.dispatch.api;

import com.marketpulse.core.model.ProviderCategory;
import com.marketpulse.core.model.ProviderRecord;
import com.marketpulse.core.provider.ProviderHealthRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for provider health: listing and operator resets.
 */
@RestController
@RequestMapping("/api/v1/providers")
public class ProviderController {

    private final ProviderHealthRegistry registry;

    public ProviderController(ProviderHealthRegistry registry) {
        this.registry = registry;
    }

    /** Body of POST /api/v1/providers/reset; {@code provider} may be a name or {@code all}. */
    public record ResetRequest(String category, String provider) {}

    @GetMapping
    public List<ProviderRecord> list() {
        return registry.snapshot();
    }

    /**
     * POST /api/v1/providers/reset: Clear failure counters and cooldowns.
     */
    @PostMapping("/reset")
    public ResponseEntity<Map<String, Object>> reset(@RequestBody ResetRequest request) {
        if (request.category() == null || request.category().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "category is required"));
        }
        ProviderCategory category;
        try {
            category = ProviderCategory.fromKey(request.category());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(
                    Map.of("error", "Unknown category: " + request.category()));
        }
        String provider = request.provider() == null || request.provider().isBlank() ? "all" : request.provider();
        int count = registry.reset(category, provider);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("category", category.key());
        body.put("provider", provider);
        body.put("reset", count);
        return ResponseEntity.ok(body);
    }
}
