package com.marketpulse.core.model;

import java.util.List;

/**
 * Static configuration of one pipeline stage.
 *
 * @param name       unique stage name, e.g. {@code research}
 * @param ordinal    position in the pipeline; stages run in ascending order
 * @param required   whether a failure of this stage aborts the session
 * @param dependsOn  stages whose successful results this stage consumes
 * @param outputType tag of the payload the stage produces
 * @param weight     weight of the stage's gate score in the overall quality score
 */
public record StageDefinition(
        String name,
        int ordinal,
        boolean required,
        List<String> dependsOn,
        String outputType,
        int weight
) {
    public StageDefinition {
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
    }
}
