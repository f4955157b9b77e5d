package com.marketpulse.core.stages;

import com.marketpulse.core.llm.AiResponseDecoder;
import com.marketpulse.core.llm.DecodedResponse;
import com.marketpulse.core.model.ProviderAttempt;
import com.marketpulse.core.model.ProviderCategory;
import com.marketpulse.core.model.StageOutcome;
import com.marketpulse.core.model.StagePayload;
import com.marketpulse.core.provider.AiProvider;
import com.marketpulse.core.provider.AllProvidersFailedException;
import com.marketpulse.core.provider.ProviderCallResult;
import com.marketpulse.core.provider.ProviderFallbackSelector;
import com.marketpulse.core.provider.ProviderRoster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Base for stages that ask an AI provider for a JSON document and decode it
 * into a typed payload.
 * <p>
 * Decoding happens inside the provider invocation, so a response that breaks
 * the expected grammar counts as that provider's failure and the selector falls
 * back to the next one.
 *
 * @param <T> payload type produced by the stage
 */
public abstract class AbstractAiStage<T extends StagePayload> implements PipelineStage {

    private static final Logger log = LoggerFactory.getLogger(AbstractAiStage.class);

    private final ProviderFallbackSelector selector;
    private final ProviderRoster<AiProvider> providers;
    private final AiResponseDecoder decoder;
    protected final PipelineProperties.Ai settings;

    protected AbstractAiStage(ProviderFallbackSelector selector, ProviderRoster<AiProvider> providers,
                              AiResponseDecoder decoder, PipelineProperties properties) {
        this.selector = selector;
        this.providers = providers;
        this.decoder = decoder;
        this.settings = properties.getAi();
    }

    protected abstract Class<T> payloadType();

    protected abstract String buildPrompt(StageContext context);

    /** Hook to enrich the decoded payload with the text it was decoded from. */
    protected T complete(T payload, String rawText) {
        return payload;
    }

    @Override
    public StageOutcome execute(StageContext context) {
        String prompt = buildPrompt(context);
        Class<T> type = payloadType();

        ProviderCallResult<DecodedResponse<T>> result;
        try {
            result = selector.call(ProviderCategory.AI, providers.providers(), provider -> {
                String text = provider.generate(prompt, settings.getMaxTokens());
                return new DecodedResponse<>(decoder.decode(text, type), text);
            });
        } catch (AllProvidersFailedException e) {
            return StageOutcome.error("Stage '" + name() + "' could not obtain a valid AI response: "
                    + e.getMessage(), e);
        }

        T payload = complete(result.value().value(), result.value().rawText());
        log.info("Stage '{}' generated by AI provider {}", name(), result.providerName());
        return StageOutcome.success(payload, Map.of(ProviderCategory.AI, result.providerName()),
                fallbackWarnings(result.attempts()));
    }

    private List<String> fallbackWarnings(List<ProviderAttempt> attempts) {
        return attempts.stream()
                .map(a -> "Stage '" + name() + "': AI provider " + a.provider()
                        + (a.skipped() ? " skipped (disabled)" : " failed (" + a.error() + ")"))
                .toList();
    }
}
