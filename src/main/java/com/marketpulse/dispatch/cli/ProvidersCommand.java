package com.marketpulse.dispatch.cli;

import com.marketpulse.core.model.ProviderCategory;
import com.marketpulse.core.model.ProviderRecord;
import com.marketpulse.core.provider.ProviderHealthRegistry;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * CLI command: marketpulse providers [--reset CATEGORY[:NAME]]
 * <p>
 * Lists provider health, optionally resetting one provider or a whole category first.
 */
@Command(name = "providers", mixinStandardHelpOptions = true,
        description = "List provider health or reset providers")
@Component
public class ProvidersCommand implements Runnable {

    @Option(names = "--reset", paramLabel = "CATEGORY[:NAME]",
            description = "Reset a provider (research:brave) or a whole category (ai)")
    private String reset;

    private final ProviderHealthRegistry registry;

    public ProvidersCommand(ProviderHealthRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        if (reset != null) {
            String[] parts = reset.split(":", 2);
            ProviderCategory category;
            try {
                category = ProviderCategory.fromKey(parts[0]);
            } catch (IllegalArgumentException e) {
                ConsoleOutput.error("Unknown category: " + parts[0] + ". Valid categories: research, ai");
                return;
            }
            String name = parts.length > 1 ? parts[1] : "all";
            int count = registry.reset(category, name);
            ConsoleOutput.success("Reset " + count + " " + category.key() + " provider(s)");
        }

        var providers = registry.snapshot();
        if (providers.isEmpty()) {
            ConsoleOutput.info("No providers configured.");
            return;
        }
        for (ProviderRecord p : providers) {
            String label = String.format("%-9s %-16s failures=%d", p.category().key(), p.name(),
                    p.consecutiveFailures());
            if (p.available()) {
                ConsoleOutput.success(label);
            } else {
                ConsoleOutput.error(label + " disabled until " + p.disabledUntil()
                        + (p.lastError() != null ? " (" + p.lastError() + ")" : ""));
            }
        }
    }
}
