package com.marketpulse.core.stages;

/**
 * Names of the built-in pipeline stages.
 */
public final class StageNames {

    public static final String RESEARCH = "research";
    public static final String SYNTHESIS = "synthesis";
    public static final String MENTAL_DRIVERS = "mental_drivers";
    public static final String VISUAL_PROOFS = "visual_proofs";
    public static final String ANTI_OBJECTION = "anti_objection";
    public static final String PRE_PITCH = "pre_pitch";
    public static final String FUTURE_PREDICTIONS = "future_predictions";

    private StageNames() {}
}
