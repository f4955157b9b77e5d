package com.marketpulse.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Structured market synthesis decoded from an AI response.
 *
 * @param avatar      ideal buyer profile
 * @param scope       market scope: segment boundaries, market size, geography
 * @param positioning positioning statements keyed by aspect
 * @param competitors competitors found in the research
 * @param insights    exclusive market insights
 * @param rawResponse AI response text the payload was decoded from
 */
public record SynthesisPayload(
        AvatarProfile avatar,
        Map<String, String> scope,
        Map<String, String> positioning,
        List<Competitor> competitors,
        List<String> insights,
        @RawContent String rawResponse
) implements StagePayload {

    public static final String OUTPUT_TYPE = "synthesis";

    public SynthesisPayload withRawResponse(String text) {
        return new SynthesisPayload(avatar, scope, positioning, competitors, insights, text);
    }

    @Override
    public String outputType() {
        return OUTPUT_TYPE;
    }

    @Override
    public List<String> missingFields() {
        List<String> missing = new ArrayList<>();
        if (avatar == null) {
            missing.add("avatar");
        } else {
            if (StagePayload.isEmpty(avatar.demographics())) {
                missing.add("avatar.demographics");
            }
            if (StagePayload.isEmpty(avatar.pains())) {
                missing.add("avatar.pains");
            }
            if (StagePayload.isEmpty(avatar.desires())) {
                missing.add("avatar.desires");
            }
        }
        if (StagePayload.isEmpty(scope)) {
            missing.add("scope");
        }
        if (StagePayload.isEmpty(insights)) {
            missing.add("insights");
        }
        return missing;
    }
}
