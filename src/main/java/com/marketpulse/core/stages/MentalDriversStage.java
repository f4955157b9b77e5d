package com.marketpulse.core.stages;

import com.marketpulse.core.llm.AiResponseDecoder;
import com.marketpulse.core.model.MentalDriversPayload;
import com.marketpulse.core.model.SynthesisPayload;
import com.marketpulse.core.provider.AiProvider;
import com.marketpulse.core.provider.ProviderFallbackSelector;
import com.marketpulse.core.provider.ProviderRoster;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Derives the psychological triggers tailored to the synthesized avatar.
 */
@Component
public class MentalDriversStage extends AbstractAiStage<MentalDriversPayload> {

    public MentalDriversStage(ProviderFallbackSelector selector, ProviderRoster<AiProvider> providers,
                              AiResponseDecoder decoder, PipelineProperties properties) {
        super(selector, providers, decoder, properties);
    }

    @Override
    public String name() {
        return StageNames.MENTAL_DRIVERS;
    }

    @Override
    public List<String> dependencies() {
        return List.of(StageNames.SYNTHESIS);
    }

    @Override
    public String outputType() {
        return MentalDriversPayload.OUTPUT_TYPE;
    }

    @Override
    protected Class<MentalDriversPayload> payloadType() {
        return MentalDriversPayload.class;
    }

    @Override
    protected String buildPrompt(StageContext context) {
        SynthesisPayload synthesis = context.input(StageNames.SYNTHESIS, SynthesisPayload.class);
        return "You are a persuasion strategist. Design the mental drivers that move this avatar to act.\n\n"
                + PromptSupport.describeRequest(context.request()) + "\n"
                + PromptSupport.describeAvatar(synthesis.avatar()) + "\n"
                + PromptSupport.JSON_INSTRUCTIONS
                + """
                Schema:
                {
                  "drivers": [
                    {"name": "...", "trigger": "...", "narrative": "...", "activationPhrase": "..."}
                  ]
                }
                Provide at least 5 drivers. Each name has at least 10 characters and each narrative
                is a story or analogy of at least 150 characters.
                """;
    }
}
