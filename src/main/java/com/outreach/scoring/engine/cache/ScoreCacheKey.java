package com.outreach.scoring.engine.cache;

import com.outreach.scoring.engine.Fingerprints;
import com.outreach.scoring.engine.Texts;
import com.outreach.scoring.model.ContactRecord;
import com.outreach.scoring.model.config.RuleConfiguration;

import java.util.Objects;

/**
 * Cache key of a score result: fingerprint of the record's normalized attributes plus
 * the configuration fingerprint.
 */
public record ScoreCacheKey(String recordFingerprint, String configFingerprint) {

    private static final String SEPARATOR = "\u001f";

    public static ScoreCacheKey of(ContactRecord record, RuleConfiguration config) {
        return new ScoreCacheKey(fingerprint(record), config.getFingerprint());
    }

    /**
     * Records differing only in case or whitespace of their descriptive fields share a fingerprint.
     * The email is only trimmed, as it is reported back as the result identifier.
     */
    public static String fingerprint(ContactRecord record) {
        String normalized = String.join(SEPARATOR,
                record.getEmail() == null ? "" : record.getEmail().trim(),
                Texts.normalize(record.getDomain()),
                Texts.normalize(record.getCompanyName()),
                Texts.normalize(record.getCountry()),
                Texts.normalize(record.getRegion()),
                Texts.normalize(record.getDescription()),
                Texts.normalize(record.getSource()),
                Objects.toString(record.getDomainAgeDays(), ""));
        return Fingerprints.sha256(normalized);
    }
}
