package com.marketpulse.core.stages;

import com.marketpulse.core.llm.AiResponseDecoder;
import com.marketpulse.core.model.AntiObjectionPayload;
import com.marketpulse.core.model.SynthesisPayload;
import com.marketpulse.core.provider.AiProvider;
import com.marketpulse.core.provider.ProviderFallbackSelector;
import com.marketpulse.core.provider.ProviderRoster;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Prepares responses to the objections recorded on the avatar.
 */
@Component
public class AntiObjectionStage extends AbstractAiStage<AntiObjectionPayload> {

    public AntiObjectionStage(ProviderFallbackSelector selector, ProviderRoster<AiProvider> providers,
                              AiResponseDecoder decoder, PipelineProperties properties) {
        super(selector, providers, decoder, properties);
    }

    @Override
    public String name() {
        return StageNames.ANTI_OBJECTION;
    }

    @Override
    public List<String> dependencies() {
        return List.of(StageNames.SYNTHESIS);
    }

    @Override
    public String outputType() {
        return AntiObjectionPayload.OUTPUT_TYPE;
    }

    @Override
    protected Class<AntiObjectionPayload> payloadType() {
        return AntiObjectionPayload.class;
    }

    @Override
    protected String buildPrompt(StageContext context) {
        SynthesisPayload synthesis = context.input(StageNames.SYNTHESIS, SynthesisPayload.class);
        return "You prepare answers to the objections a buyer raises before purchasing.\n\n"
                + PromptSupport.describeRequest(context.request()) + "\n"
                + PromptSupport.describeAvatar(synthesis.avatar()) + "\n"
                + PromptSupport.JSON_INSTRUCTIONS
                + """
                Schema:
                {
                  "responses": [
                    {"objection": "...", "response": "...", "proof": "..."}
                  ]
                }
                Answer every listed objection, at least 3.
                """;
    }
}
