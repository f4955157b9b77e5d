package com.marketpulse.core.stages;

import com.marketpulse.core.model.AnalysisRequest;
import com.marketpulse.core.model.AvatarProfile;

import java.util.List;

/**
 * Text fragments shared by the AI stage prompts.
 */
final class PromptSupport {

    static final String JSON_INSTRUCTIONS = """
            Respond in Brazilian Portuguese with a single JSON object inside one ```json fenced block.
            Use exactly the field names of the schema below. Do not add commentary outside the block.
            Never use placeholders or generic filler; every item must be specific to this market.
            """;

    private PromptSupport() {}

    static String describeRequest(AnalysisRequest request) {
        var sb = new StringBuilder();
        sb.append("Segment: ").append(request.segment()).append('\n');
        appendIfPresent(sb, "Product", request.product());
        appendIfPresent(sb, "Target audience", request.targetAudience());
        if (request.price() != null) {
            sb.append("Price: ").append(request.price()).append('\n');
        }
        if (request.revenueGoal() != null) {
            sb.append("Revenue goal: ").append(request.revenueGoal()).append('\n');
        }
        if (request.marketingBudget() != null) {
            sb.append("Marketing budget: ").append(request.marketingBudget()).append('\n');
        }
        return sb.toString();
    }

    static String describeAvatar(AvatarProfile avatar) {
        if (avatar == null) {
            return "";
        }
        return "Avatar: " + avatar.name() + '\n'
                + "Pains:\n" + bullets(avatar.pains())
                + "Desires:\n" + bullets(avatar.desires())
                + "Objections:\n" + bullets(avatar.objections());
    }

    static String bullets(List<String> items) {
        if (items == null || items.isEmpty()) {
            return "";
        }
        var sb = new StringBuilder();
        for (String item : items) {
            sb.append("- ").append(item).append('\n');
        }
        return sb.toString();
    }

    private static void appendIfPresent(StringBuilder sb, String label, String value) {
        if (value != null && !value.isBlank()) {
            sb.append(label).append(": ").append(value).append('\n');
        }
    }
}
