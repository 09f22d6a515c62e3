package com.outreach.scoring.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Result of the anomaly classifier for one record: the highest-severity flag's type and severity,
 * with every contributing flag listed.
 */
@Value
@Builder
@Schema(description = "Anomaly classification of one record")
public class AnomalyReport {

    String identifier;

    AnomalyType type;

    Severity severity;

    List<AnomalyFlag> flags;

    public boolean isAnomalous() {
        return severity != Severity.NONE;
    }

    public List<String> getReasons() {
        return flags.stream().map(AnomalyFlag::getReason).toList();
    }

    public static AnomalyReport clean(String identifier) {
        return AnomalyReport.builder()
                .identifier(identifier)
                .type(AnomalyType.NONE)
                .severity(Severity.NONE)
                .flags(List.of())
                .build();
    }
}
