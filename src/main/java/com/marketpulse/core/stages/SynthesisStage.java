package com.marketpulse.core.stages;

import com.marketpulse.core.llm.AiResponseDecoder;
import com.marketpulse.core.model.ResearchPayload;
import com.marketpulse.core.model.ResearchStatistics;
import com.marketpulse.core.model.SourceDocument;
import com.marketpulse.core.model.SynthesisPayload;
import com.marketpulse.core.provider.AiProvider;
import com.marketpulse.core.provider.ProviderFallbackSelector;
import com.marketpulse.core.provider.ProviderRoster;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * Turns the research corpus into a structured market synthesis: avatar,
 * positioning, competitors and insights.
 */
@Component
public class SynthesisStage extends AbstractAiStage<SynthesisPayload> {

    public SynthesisStage(ProviderFallbackSelector selector, ProviderRoster<AiProvider> providers,
                          AiResponseDecoder decoder, PipelineProperties properties) {
        super(selector, providers, decoder, properties);
    }

    @Override
    public String name() {
        return StageNames.SYNTHESIS;
    }

    @Override
    public List<String> dependencies() {
        return List.of(StageNames.RESEARCH);
    }

    @Override
    public String outputType() {
        return SynthesisPayload.OUTPUT_TYPE;
    }

    @Override
    protected Class<SynthesisPayload> payloadType() {
        return SynthesisPayload.class;
    }

    @Override
    protected SynthesisPayload complete(SynthesisPayload payload, String rawText) {
        return payload.withRawResponse(rawText);
    }

    @Override
    protected String buildPrompt(StageContext context) {
        ResearchPayload research = context.input(StageNames.RESEARCH, ResearchPayload.class);
        ResearchStatistics stats = research.statistics();

        var sb = new StringBuilder();
        sb.append("You are a senior market analyst. Build a market synthesis from the research below.\n\n");
        sb.append(PromptSupport.describeRequest(context.request())).append('\n');
        sb.append("Research coverage: ").append(stats.successfulExtractions()).append(" sources, ")
                .append(stats.uniqueDomains()).append(" domains, ")
                .append(stats.totalContentLength()).append(" characters, average quality ")
                .append(stats.avgQualityScore()).append(".\n");
        sb.append("Sources are listed from highest to lowest quality.\n\n");

        List<SourceDocument> sources = research.sources().stream()
                .sorted(Comparator.comparingInt(SourceDocument::qualityScore).reversed())
                .toList();
        int excerpts = Math.min(settings.getMaxExcerpts(), sources.size());
        for (int i = 0; i < excerpts; i++) {
            SourceDocument doc = sources.get(i);
            String content = doc.content();
            sb.append("### Source ").append(i + 1).append(": ").append(doc.title()).append(" (").append(doc.url()).append(")\n");
            sb.append(content, 0, Math.min(settings.getExcerptLength(), content.length())).append("\n\n");
        }

        sb.append(PromptSupport.JSON_INSTRUCTIONS);
        sb.append("""
                Schema:
                {
                  "avatar": {
                    "name": "...",
                    "demographics": {"age": "...", "income": "...", "location": "...", "occupation": "..."},
                    "psychographics": {"values": "...", "lifestyle": "...", "aspirations": "..."},
                    "pains": ["at least 8 concrete pains"],
                    "desires": ["at least 8 concrete desires"],
                    "objections": ["..."]
                  },
                  "scope": {"segment": "...", "marketSize": "...", "geography": "...", "trends": "..."},
                  "positioning": {"statement": "...", "differentiation": "...", "valueProposition": "..."},
                  "competitors": [{"name": "...", "positioning": "...", "strengths": ["..."], "weaknesses": ["..."]}],
                  "insights": ["at least 15 specific insights grounded in the sources, each at least 50 characters"]
                }
                """);
        return sb.toString();
    }
}
