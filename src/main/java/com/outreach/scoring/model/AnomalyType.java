package com.outreach.scoring.model;

public enum AnomalyType {
    NONE,
    STATISTICAL_OUTLIER,
    DISPOSABLE_DOMAIN,
    BOT_GENERATED,
    SPAM_TRAP,
    SUSPICIOUS_KEYWORD,
    QUALITY_PATTERN,
    LOCAL_OUTLIER
}
