package com.outreach.scoring.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "bulk")
public class BulkUpdateProperties {

    // JSON catalog of list metadata rewritten by bulk updates.
    private String storePath = "data/lists_config.json";

    // Request bodies above this size are rejected before parsing.
    private long maxRequestBytes = 1024 * 1024;

    private int maxIdentifierLength = 255;

    // Extension, if an identifier has one, must be one of these (lower-case, with dot).
    private List<String> allowedExtensions = new ArrayList<>(List.of(".txt", ".lvp", ".csv", ".json"));

    // Shell metacharacters rejected anywhere in an identifier.
    private List<String> forbiddenCharacters = new ArrayList<>(List.of(
            ";", "&", "|", "`", "$", "(", ")", "{", "}", "[", "]", "<", ">", "!", "\n", "\r"));
}
