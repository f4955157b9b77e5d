package com.marketpulse.core.stages;

import com.marketpulse.core.model.StageOutcome;

import java.util.List;

/**
 * A unit of pipeline work producing one typed payload.
 * <p>
 * Implementations report expected failures as {@link StageOutcome.Kind#ERROR}
 * instead of throwing.
 */
public interface PipelineStage {

    String name();

    /** Stages whose payloads this stage reads through {@link StageContext#input}. */
    List<String> dependencies();

    String outputType();

    StageOutcome execute(StageContext context);
}
