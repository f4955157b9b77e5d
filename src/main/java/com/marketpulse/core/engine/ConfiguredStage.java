package com.marketpulse.core.engine;

import com.marketpulse.core.model.StageDefinition;
import com.marketpulse.core.qualitygate.QualityRuleset;
import com.marketpulse.core.stages.PipelineStage;

/**
 * A stage definition bound to its work function and quality ruleset.
 */
public record ConfiguredStage(StageDefinition definition, PipelineStage stage, QualityRuleset ruleset) {

    public String name() {
        return definition.name();
    }
}
