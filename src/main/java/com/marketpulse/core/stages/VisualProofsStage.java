package com.marketpulse.core.stages;

import com.marketpulse.core.llm.AiResponseDecoder;
import com.marketpulse.core.model.SynthesisPayload;
import com.marketpulse.core.model.VisualProofsPayload;
import com.marketpulse.core.provider.AiProvider;
import com.marketpulse.core.provider.ProviderFallbackSelector;
import com.marketpulse.core.provider.ProviderRoster;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Designs demonstrations that make the synthesized insights tangible.
 */
@Component
public class VisualProofsStage extends AbstractAiStage<VisualProofsPayload> {

    public VisualProofsStage(ProviderFallbackSelector selector, ProviderRoster<AiProvider> providers,
                             AiResponseDecoder decoder, PipelineProperties properties) {
        super(selector, providers, decoder, properties);
    }

    @Override
    public String name() {
        return StageNames.VISUAL_PROOFS;
    }

    @Override
    public List<String> dependencies() {
        return List.of(StageNames.SYNTHESIS);
    }

    @Override
    public String outputType() {
        return VisualProofsPayload.OUTPUT_TYPE;
    }

    @Override
    protected Class<VisualProofsPayload> payloadType() {
        return VisualProofsPayload.class;
    }

    @Override
    protected String buildPrompt(StageContext context) {
        SynthesisPayload synthesis = context.input(StageNames.SYNTHESIS, SynthesisPayload.class);
        return "You design physical demonstrations that prove abstract claims during a presentation.\n\n"
                + PromptSupport.describeRequest(context.request()) + "\n"
                + PromptSupport.describeAvatar(synthesis.avatar()) + "\n"
                + "Insights:\n" + PromptSupport.bullets(synthesis.insights()) + "\n"
                + PromptSupport.JSON_INSTRUCTIONS
                + """
                Schema:
                {
                  "proofs": [
                    {"concept": "...", "demonstration": "...", "materials": ["..."], "expectedImpact": "..."}
                  ]
                }
                Provide at least 3 proofs. Each demonstration describes the experiment in at least
                100 characters and lists at least 3 materials.
                """;
    }
}
