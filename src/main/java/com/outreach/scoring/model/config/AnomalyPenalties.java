package com.outreach.scoring.model.config;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

/**
 * Multipliers applied to the composite for LOW/MEDIUM/HIGH anomaly severities.
 * CRITICAL is not configurable: it always excludes the record.
 */
@Value
@Builder(toBuilder = true)
@Schema(description = "Composite multipliers per anomaly severity")
public class AnomalyPenalties {

    @Builder.Default
    double low = 1.0;

    @Builder.Default
    double medium = 0.85;

    @Builder.Default
    double high = 0.6;

    public static AnomalyPenalties defaults() {
        return AnomalyPenalties.builder().build();
    }
}
