package com.outreach.scoring.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "scoring")
public class ScoringProperties {

    // Template used when a request does not carry its own configuration.
    private String defaultTemplate = "generic";

    private Cache cache = new Cache();

    private Batch batch = new Batch();

    // Interactive editing: recompute at most once per quiescence window after the last edit.
    private Duration debounceWindow = Duration.ofMillis(500);

    @Data
    public static class Cache {
        // Maximum cached score results; least-recently-used entries are evicted beyond this.
        private int capacity = 10_000;

        // Entries older than this are treated as absent.
        private Duration ttl = Duration.ofMinutes(30);
    }

    @Data
    public static class Batch {
        // Worker threads for batch scoring. 0 = number of available processors.
        private int parallelism = 0;

        // Batches smaller than this are scored on the calling thread.
        private int parallelThreshold = 64;
    }
}
