package com.outreach.scoring.engine.anomaly;

import com.outreach.scoring.engine.AddressMetrics;
import com.outreach.scoring.model.ContactRecord;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Numeric features the anomaly classifier compares against its reference population.
 */
public enum AddressFeature {

    LOCAL_PART_LENGTH("local-part length"),
    DOMAIN_LENGTH("domain length"),
    DIGIT_RATIO("digit ratio"),
    SPECIAL_CHAR_RATIO("special-character ratio"),
    DOMAIN_AGE_DAYS("domain age in days");

    // Known for every address; these form the vector used by the neighbor-density check.
    public static final List<AddressFeature> STRUCTURAL =
            List.of(LOCAL_PART_LENGTH, DOMAIN_LENGTH, DIGIT_RATIO, SPECIAL_CHAR_RATIO);

    private final String label;

    AddressFeature(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Value of this feature for the record, empty when the record does not carry it.
     */
    public OptionalDouble measure(AddressMetrics metrics, ContactRecord record) {
        return switch (this) {
            case LOCAL_PART_LENGTH -> OptionalDouble.of(metrics.localLength());
            case DOMAIN_LENGTH -> OptionalDouble.of(metrics.domainLength());
            case DIGIT_RATIO -> OptionalDouble.of(metrics.digitRatio());
            case SPECIAL_CHAR_RATIO -> OptionalDouble.of(metrics.specialCharRatio());
            case DOMAIN_AGE_DAYS -> record != null && record.getDomainAgeDays() != null
                    ? OptionalDouble.of(record.getDomainAgeDays())
                    : OptionalDouble.empty();
        };
    }
}
