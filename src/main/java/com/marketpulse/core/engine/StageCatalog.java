package com.marketpulse.core.engine;

import com.marketpulse.core.model.StageDefinition;
import com.marketpulse.core.qualitygate.QualityRulesetCatalog;
import com.marketpulse.core.stages.PipelineProperties;
import com.marketpulse.core.stages.PipelineStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Assembles the configured pipeline: stage order, required flags and weights
 * from {@link PipelineProperties}, work functions from the registered
 * {@link PipelineStage} beans, rulesets from {@link QualityRulesetCatalog}.
 */
@Component
public class StageCatalog {

    private static final Logger log = LoggerFactory.getLogger(StageCatalog.class);

    private final List<ConfiguredStage> stages;

    public StageCatalog(PipelineProperties properties, List<PipelineStage> available,
                        QualityRulesetCatalog rulesets) {
        Map<String, PipelineStage> byName = new LinkedHashMap<>();
        for (PipelineStage stage : available) {
            if (byName.putIfAbsent(stage.name(), stage) != null) {
                throw new IllegalStateException("Duplicate pipeline stage: " + stage.name());
            }
        }

        List<ConfiguredStage> configured = new ArrayList<>();
        int ordinal = 0;
        for (String name : properties.getOrder()) {
            PipelineStage stage = byName.get(name);
            if (stage == null) {
                throw new IllegalStateException("Unknown pipeline stage in marketpulse.pipeline.order: " + name);
            }
            ordinal++;
            PipelineProperties.StageSettings settings = properties.settingsFor(name);
            if (!settings.isEnabled()) {
                log.info("Stage '{}' disabled by configuration", name);
                continue;
            }
            var definition = new StageDefinition(name, ordinal, settings.isRequired(), stage.dependencies(),
                    stage.outputType(), settings.getWeight());
            configured.add(new ConfiguredStage(definition, stage, rulesets.rulesetFor(name)));
        }

        StageSequencer.validateOrder(configured.stream().map(ConfiguredStage::definition).toList());
        this.stages = List.copyOf(configured);
        log.info("Pipeline: {}", describe());
    }

    public List<ConfiguredStage> stages() {
        return stages;
    }

    public List<StageDefinition> definitions() {
        return stages.stream().map(ConfiguredStage::definition).toList();
    }

    private String describe() {
        var sb = new StringBuilder();
        for (ConfiguredStage s : stages) {
            if (sb.length() > 0) {
                sb.append(" -> ");
            }
            sb.append(s.name()).append(s.definition().required() ? "" : " (optional)");
        }
        return sb.toString();
    }
}
