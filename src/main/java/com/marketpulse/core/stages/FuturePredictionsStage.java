package com.marketpulse.core.stages;

import com.marketpulse.core.llm.AiResponseDecoder;
import com.marketpulse.core.model.FuturePredictionsPayload;
import com.marketpulse.core.model.ResearchPayload;
import com.marketpulse.core.model.SynthesisPayload;
import com.marketpulse.core.provider.AiProvider;
import com.marketpulse.core.provider.ProviderFallbackSelector;
import com.marketpulse.core.provider.ProviderRoster;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Optional forecast of the segment built from research queries and synthesis insights.
 */
@Component
public class FuturePredictionsStage extends AbstractAiStage<FuturePredictionsPayload> {

    public FuturePredictionsStage(ProviderFallbackSelector selector, ProviderRoster<AiProvider> providers,
                                  AiResponseDecoder decoder, PipelineProperties properties) {
        super(selector, providers, decoder, properties);
    }

    @Override
    public String name() {
        return StageNames.FUTURE_PREDICTIONS;
    }

    @Override
    public List<String> dependencies() {
        return List.of(StageNames.RESEARCH, StageNames.SYNTHESIS);
    }

    @Override
    public String outputType() {
        return FuturePredictionsPayload.OUTPUT_TYPE;
    }

    @Override
    protected Class<FuturePredictionsPayload> payloadType() {
        return FuturePredictionsPayload.class;
    }

    @Override
    protected String buildPrompt(StageContext context) {
        ResearchPayload research = context.input(StageNames.RESEARCH, ResearchPayload.class);
        SynthesisPayload synthesis = context.input(StageNames.SYNTHESIS, SynthesisPayload.class);
        return "You are a market futurist. Forecast how this segment evolves over the next 36 months.\n\n"
                + PromptSupport.describeRequest(context.request()) + "\n"
                + "Queries researched:\n" + PromptSupport.bullets(research.queries()) + "\n"
                + "Insights:\n" + PromptSupport.bullets(synthesis.insights()) + "\n"
                + PromptSupport.JSON_INSTRUCTIONS
                + """
                Schema:
                {
                  "horizonMonths": 36,
                  "scenarios": [
                    {"name": "...", "probability": 0.5, "description": "...", "signals": ["..."]}
                  ],
                  "emergingTrends": ["..."]
                }
                Provide at least 3 scenarios whose probabilities sum to 1.
                """;
    }
}
