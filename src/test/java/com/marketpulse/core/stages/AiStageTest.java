package com.marketpulse.core.stages;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketpulse.core.llm.AiResponseDecoder;
import com.marketpulse.core.metrics.PipelineMetrics;
import com.marketpulse.core.model.AnalysisRequest;
import com.marketpulse.core.model.AntiObjectionPayload;
import com.marketpulse.core.model.AvatarProfile;
import com.marketpulse.core.model.MentalDriversPayload;
import com.marketpulse.core.model.PrePitchPayload;
import com.marketpulse.core.model.ProviderCategory;
import com.marketpulse.core.model.ResearchPayload;
import com.marketpulse.core.model.ResearchStatistics;
import com.marketpulse.core.model.SourceDocument;
import com.marketpulse.core.model.SynthesisPayload;
import com.marketpulse.core.model.VisualProofsPayload;
import com.marketpulse.core.provider.AiProvider;
import com.marketpulse.core.provider.AllProvidersFailedException;
import com.marketpulse.core.provider.ProviderFallbackSelector;
import com.marketpulse.core.provider.ProviderHealthRegistry;
import com.marketpulse.core.provider.ProviderRoster;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AiStageTest {

    private static final String DRIVERS_JSON = """
            ```json
            {"drivers": [{"name": "Pertencimento", "trigger": "comunidade", "narrative": "n", "activationPhrase": "f"}]}
            ```""";

    private static final String SYNTHESIS_JSON = """
            {"avatar": {"name": "Lucas", "pains": ["tempo"], "desires": ["status"], "objections": []},
             "positioning": {"statement": "s"}, "competitors": [], "insights": ["i1"]}""";

    private final AnalysisRequest request = AnalysisRequest.forSegment("coworkings corporativos", "salas privativas");
    private final AiResponseDecoder decoder = new AiResponseDecoder(new ObjectMapper());

    private ProviderHealthRegistry registry;
    private ProviderFallbackSelector selector;
    private PipelineProperties properties;

    @BeforeEach
    void setUp() {
        registry = new ProviderHealthRegistry(1, Duration.ofMinutes(5), Clock.systemUTC());
        selector = new ProviderFallbackSelector(registry, new PipelineMetrics(new SimpleMeterRegistry()),
                Duration.ofSeconds(2));
        properties = new PipelineProperties();
    }

    @AfterEach
    void tearDown() {
        selector.shutdown();
    }

    private ProviderRoster<AiProvider> roster(AiProvider... providers) {
        return new ProviderRoster<>(ProviderCategory.AI, List.of(providers));
    }

    private static SynthesisPayload synthesis() {
        var avatar = new AvatarProfile("Lucas", Map.of("idade", "28-40"), Map.of(), List.of("falta de foco em casa"),
                List.of("networking"), List.of("custo fixo"));
        return new SynthesisPayload(avatar, Map.of("segmento", "coworkings"), Map.of("statement", "s"), List.of(),
                List.of("insight"), null);
    }

    private static ResearchPayload research() {
        var docs = List.of(
                new SourceDocument("https://a.com", "Relatório A", "conteúdo ".repeat(400), "q", "brave", 60),
                new SourceDocument("https://b.com", "Relatório B", "análise ".repeat(400), "q", "brave", 90));
        return new ResearchPayload(List.of("q"), docs, new ResearchStatistics(1, 2, 2, 6800, 2, 3400, 1, 75.0),
                List.of());
    }

    @Nested
    @DisplayName("mental drivers")
    class MentalDrivers {

        private StageContext context() {
            return new StageContext("MP-1", request, Map.of(StageNames.SYNTHESIS, synthesis()));
        }

        @Test
        @DisplayName("decodes the response and names the serving provider")
        void success() {
            var provider = new ScriptedAi("gemini", DRIVERS_JSON);

            var outcome = new MentalDriversStage(selector, roster(provider), decoder, properties).execute(context());

            assertTrue(outcome.isSuccess());
            assertEquals("Pertencimento", ((MentalDriversPayload) outcome.payload()).drivers().get(0).name());
            assertEquals(Map.of(ProviderCategory.AI, "gemini"), outcome.providersUsed());
            assertTrue(outcome.warnings().isEmpty());
            assertTrue(provider.prompts.get(0).contains("falta de foco em casa"));
            assertTrue(provider.prompts.get(0).contains("salas privativas"));
        }

        @Test
        @DisplayName("an unparseable response counts against the provider and falls back")
        void badFormatFallsBack() {
            var sloppy = new ScriptedAi("groq", "Claro! Aqui vão os gatilhos mentais.");
            var good = new ScriptedAi("openai", DRIVERS_JSON);

            var outcome = new MentalDriversStage(selector, roster(sloppy, good), decoder, properties)
                    .execute(context());

            assertTrue(outcome.isSuccess());
            assertEquals("openai", outcome.providersUsed().get(ProviderCategory.AI));
            assertEquals(1, outcome.warnings().size());
            assertTrue(outcome.warnings().get(0).startsWith("Stage 'mental_drivers': AI provider groq failed ("));
            assertTrue(registry.isDisabled(ProviderCategory.AI, "groq"));
        }

        @Test
        @DisplayName("a disabled provider is reported as skipped")
        void skippedWarning() {
            registry.recordFailure(ProviderCategory.AI, "gemini", "quota");
            var outcome = new MentalDriversStage(selector,
                    roster(new ScriptedAi("gemini", DRIVERS_JSON), new ScriptedAi("groq", DRIVERS_JSON)),
                    decoder, properties).execute(context());

            assertEquals(List.of("Stage 'mental_drivers': AI provider gemini skipped (disabled)"), outcome.warnings());
        }

        @Test
        @DisplayName("exhausted providers yield an error outcome instead of an exception")
        void exhausted() {
            var outcome = new MentalDriversStage(selector, roster(new ScriptedAi("gemini", null)), decoder, properties)
                    .execute(context());

            assertFalse(outcome.isSuccess());
            assertInstanceOf(AllProvidersFailedException.class, outcome.cause());
            assertTrue(outcome.message().contains("mental_drivers"));
        }
    }

    @Nested
    @DisplayName("synthesis")
    class Synthesis {

        @Test
        @DisplayName("keeps the raw response and quotes research excerpts best quality first")
        void rawResponseKept() {
            var provider = new ScriptedAi("gemini", SYNTHESIS_JSON);
            properties.getAi().setExcerptLength(100);
            var context = new StageContext("MP-1", request, Map.of(StageNames.RESEARCH, research()));

            var outcome = new SynthesisStage(selector, roster(provider), decoder, properties).execute(context);

            var payload = (SynthesisPayload) outcome.payload();
            assertEquals(SYNTHESIS_JSON, payload.rawResponse());
            assertEquals("Lucas", payload.avatar().name());
            String prompt = provider.prompts.get(0);
            assertTrue(prompt.contains("### Source 1: Relatório B (https://b.com)"));
            assertTrue(prompt.contains("### Source 2: Relatório A (https://a.com)"));
            assertTrue(prompt.contains("average quality 75.0"));
            assertFalse(prompt.contains("conteúdo ".repeat(20)));
        }

        @Test
        void missingResearchInputIsAnError() {
            var context = new StageContext("MP-1", request, Map.of());
            var stage = new SynthesisStage(selector, roster(new ScriptedAi("gemini", SYNTHESIS_JSON)), decoder,
                    properties);

            assertThrows(IllegalStateException.class, () -> stage.execute(context));
        }
    }

    @Nested
    @DisplayName("derived stages")
    class DerivedStages {

        @Test
        @DisplayName("pre-pitch feeds the accepted mental drivers into its prompt")
        void prePitchUsesDrivers() {
            var provider = new ScriptedAi("gemini", """
                    {"phases": [{"name": "Quebra", "objective": "o", "drivers": ["Pertencimento"], "script": "s"}],
                     "transitionScript": "t"}""");
            var drivers = new MentalDriversPayload(List.of(
                    new MentalDriversPayload.Driver("Pertencimento", "comunidade", "n", "f")));
            var context = new StageContext("MP-1", request,
                    Map.of(StageNames.SYNTHESIS, synthesis(), StageNames.MENTAL_DRIVERS, drivers));

            var stage = new PrePitchStage(selector, roster(provider), decoder, properties);
            var outcome = stage.execute(context);

            assertEquals(List.of(StageNames.SYNTHESIS, StageNames.MENTAL_DRIVERS), stage.dependencies());
            assertTrue(outcome.isSuccess());
            assertEquals("t", ((PrePitchPayload) outcome.payload()).transitionScript());
            assertTrue(provider.prompts.get(0).contains("- Pertencimento: comunidade"));
        }

        @Test
        void visualProofs() {
            var provider = new ScriptedAi("gemini", """
                    {"proofs": [{"concept": "foco", "demonstration": "d", "materials": ["cronômetro"],
                                 "expectedImpact": "e"}]}""");
            var context = new StageContext("MP-1", request, Map.of(StageNames.SYNTHESIS, synthesis()));

            var outcome = new VisualProofsStage(selector, roster(provider), decoder, properties).execute(context);

            assertTrue(outcome.isSuccess());
            assertEquals(List.of("cronômetro"), ((VisualProofsPayload) outcome.payload()).proofs().get(0).materials());
            assertTrue(provider.prompts.get(0).contains("insight"));
        }

        @Test
        @DisplayName("anti-objection errors when every provider fails")
        void antiObjectionExhausted() {
            var context = new StageContext("MP-1", request, Map.of(StageNames.SYNTHESIS, synthesis()));

            var outcome = new AntiObjectionStage(selector, roster(new ScriptedAi("gemini", null),
                    new ScriptedAi("groq", "sem json")), decoder, properties).execute(context);

            assertFalse(outcome.isSuccess());
            assertInstanceOf(AllProvidersFailedException.class, outcome.cause());
            assertEquals(AntiObjectionPayload.OUTPUT_TYPE, new AntiObjectionStage(selector, roster(), decoder,
                    properties).outputType());
        }
    }

    @Test
    @DisplayName("future predictions depend on both research and synthesis")
    void futurePredictionsDependencies() {
        var stage = new FuturePredictionsStage(selector, roster(), decoder, properties);
        assertEquals(List.of(StageNames.RESEARCH, StageNames.SYNTHESIS), stage.dependencies());
    }

    private static final class ScriptedAi implements AiProvider {

        private final String name;
        private final String response;
        final List<String> prompts = new ArrayList<>();

        ScriptedAi(String name, String response) {
            this.name = name;
            this.response = response;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public synchronized String generate(String prompt, int maxTokens) {
            prompts.add(prompt);
            if (response == null) {
                throw new IllegalStateException("503 from upstream");
            }
            return response;
        }
    }
}
