package com.marketpulse.core.engine;

import com.marketpulse.core.model.MentalDriversPayload;
import com.marketpulse.core.model.StageDefinition;
import com.marketpulse.core.model.StageOutcome;
import com.marketpulse.core.qualitygate.QualityRuleset;
import com.marketpulse.core.stages.PipelineStage;
import com.marketpulse.core.stages.StageContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Scripted stage for sequencer tests. Records the contexts it was called with.
 */
class FakeStage implements PipelineStage {

    private final String name;
    private final List<String> dependencies;
    private final Function<StageContext, StageOutcome> behaviour;
    final List<StageContext> calls = new ArrayList<>();

    FakeStage(String name, List<String> dependencies, Function<StageContext, StageOutcome> behaviour) {
        this.name = name;
        this.dependencies = dependencies;
        this.behaviour = behaviour;
    }

    static FakeStage succeeding(String name, String... dependencies) {
        return new FakeStage(name, List.of(dependencies), ctx -> StageOutcome.success(drivers(name), Map.of()));
    }

    static FakeStage failing(String name, String message, String... dependencies) {
        return new FakeStage(name, List.of(dependencies), ctx -> StageOutcome.error(message, null));
    }

    static MentalDriversPayload drivers(String label) {
        return new MentalDriversPayload(List.of(
                new MentalDriversPayload.Driver(label, "gatilho", "narrativa", "frase")));
    }

    ConfiguredStage configured(int ordinal, boolean required) {
        return configured(ordinal, required, 1, QualityRuleset.shapeOnly(name, 75));
    }

    ConfiguredStage configured(int ordinal, boolean required, int weight, QualityRuleset ruleset) {
        return new ConfiguredStage(
                new StageDefinition(name, ordinal, required, dependencies, outputType(), weight), this, ruleset);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<String> dependencies() {
        return dependencies;
    }

    @Override
    public String outputType() {
        return MentalDriversPayload.OUTPUT_TYPE;
    }

    @Override
    public StageOutcome execute(StageContext context) {
        calls.add(context);
        return behaviour.apply(context);
    }
}
