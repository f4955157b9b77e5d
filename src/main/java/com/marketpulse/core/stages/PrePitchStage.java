package com.marketpulse.core.stages;

import com.marketpulse.core.llm.AiResponseDecoder;
import com.marketpulse.core.model.MentalDriversPayload;
import com.marketpulse.core.model.PrePitchPayload;
import com.marketpulse.core.model.SynthesisPayload;
import com.marketpulse.core.provider.AiProvider;
import com.marketpulse.core.provider.ProviderFallbackSelector;
import com.marketpulse.core.provider.ProviderRoster;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Sequences the mental drivers into the phases that precede the offer.
 */
@Component
public class PrePitchStage extends AbstractAiStage<PrePitchPayload> {

    public PrePitchStage(ProviderFallbackSelector selector, ProviderRoster<AiProvider> providers,
                         AiResponseDecoder decoder, PipelineProperties properties) {
        super(selector, providers, decoder, properties);
    }

    @Override
    public String name() {
        return StageNames.PRE_PITCH;
    }

    @Override
    public List<String> dependencies() {
        return List.of(StageNames.SYNTHESIS, StageNames.MENTAL_DRIVERS);
    }

    @Override
    public String outputType() {
        return PrePitchPayload.OUTPUT_TYPE;
    }

    @Override
    protected Class<PrePitchPayload> payloadType() {
        return PrePitchPayload.class;
    }

    @Override
    protected String buildPrompt(StageContext context) {
        SynthesisPayload synthesis = context.input(StageNames.SYNTHESIS, SynthesisPayload.class);
        MentalDriversPayload drivers = context.input(StageNames.MENTAL_DRIVERS, MentalDriversPayload.class);

        var driverNames = new StringBuilder();
        for (MentalDriversPayload.Driver driver : drivers.drivers()) {
            driverNames.append("- ").append(driver.name()).append(": ").append(driver.trigger()).append('\n');
        }

        return "You orchestrate the pre-pitch: the emotional sequence that prepares the audience for the offer.\n\n"
                + PromptSupport.describeRequest(context.request()) + "\n"
                + PromptSupport.describeAvatar(synthesis.avatar()) + "\n"
                + "Mental drivers available:\n" + driverNames + "\n"
                + PromptSupport.JSON_INSTRUCTIONS
                + """
                Schema:
                {
                  "phases": [
                    {"name": "...", "objective": "...", "drivers": ["driver names"], "script": "..."}
                  ],
                  "transitionScript": "..."
                }
                Provide at least 3 phases.
                """;
    }
}
