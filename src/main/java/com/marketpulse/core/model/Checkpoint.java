package com.marketpulse.core.model;

import com.fasterxml.jackson.annotation.JsonRawValue;

import java.time.Instant;

/**
 * Append-only record of a stage outcome or gate report.
 *
 * @param sessionId session the checkpoint belongs to
 * @param sequence  store-assigned position, increasing in append order
 * @param stage     stage label
 * @param category  category tag, e.g. {@code research_data} or {@code quality_gate}
 * @param payload   serialized JSON payload
 * @param timestamp when the checkpoint was appended
 */
public record Checkpoint(
        String sessionId,
        long sequence,
        String stage,
        String category,
        @JsonRawValue String payload,
        Instant timestamp
) {}
