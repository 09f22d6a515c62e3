package com.outreach.scoring.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.outreach.scoring.config.ScoringProperties;
import com.outreach.scoring.engine.config.ConfigurationCodec;
import com.outreach.scoring.engine.config.RuleConfigurationValidator;
import com.outreach.scoring.exception.SchemaException;
import com.outreach.scoring.exception.TemplateNotFoundException;
import com.outreach.scoring.model.config.RuleConfiguration;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Validation, merging and serialization of rule configurations, plus the built-in template library
 * loaded from {@code classpath:templates/*.json}.
 */
@Service
public class RuleConfigurationService {

    private static final Logger log = LoggerFactory.getLogger(RuleConfigurationService.class);

    static final String TEMPLATE_LOCATION = "classpath:templates/*.json";

    private final RuleConfigurationValidator validator;
    private final ConfigurationCodec codec;
    private final ScoringProperties properties;
    private final ResourcePatternResolver resourceResolver;

    private volatile Map<String, RuleConfiguration> templates = Map.of();

    public RuleConfigurationService(RuleConfigurationValidator validator, ConfigurationCodec codec,
                                    ScoringProperties properties) {
        this.validator = validator;
        this.codec = codec;
        this.properties = properties;
        this.resourceResolver = new PathMatchingResourcePatternResolver();
    }

    /**
     * Load and validate the built-in templates. An invalid template fails startup.
     */
    @PostConstruct
    public void loadTemplates() {
        Map<String, RuleConfiguration> loaded = new TreeMap<>();
        try {
            for (Resource resource : resourceResolver.getResources(TEMPLATE_LOCATION)) {
                String filename = resource.getFilename();
                if (filename == null) {
                    continue;
                }
                String name = filename.substring(0, filename.length() - ".json".length());
                try (InputStream in = resource.getInputStream()) {
                    loaded.put(name, validator.validate(new String(in.readAllBytes(), StandardCharsets.UTF_8)));
                } catch (SchemaException e) {
                    throw new IllegalStateException("Built-in template '" + name + "' is invalid: " + e.getMessage(), e);
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load configuration templates", e);
        }
        templates = Collections.unmodifiableMap(loaded);
        log.info("Loaded {} configuration templates: {}", loaded.size(), loaded.keySet());
    }

    public RuleConfiguration validate(String document) {
        return validator.validate(document);
    }

    public RuleConfiguration validate(JsonNode document) {
        return validator.validate(document);
    }

    /**
     * Deep-merge a partial override document onto a base document and validate the result.
     */
    public RuleConfiguration merge(JsonNode base, JsonNode override) {
        return validator.validate(ConfigurationCodec.deepMerge(base, override));
    }

    public RuleConfiguration merge(RuleConfiguration base, JsonNode override) {
        return merge(codec.toTree(base), override);
    }

    public RuleConfiguration merge(RuleConfiguration base, RuleConfiguration override) {
        return merge(codec.toTree(base), codec.toTree(override));
    }

    public List<String> templateNames() {
        return new ArrayList<>(templates.keySet());
    }

    public RuleConfiguration template(String name) {
        RuleConfiguration template = templates.get(name);
        if (template == null) {
            throw new TemplateNotFoundException(name);
        }
        return template;
    }

    /**
     * Template with a partial override merged on top. A null override returns the template as-is.
     */
    public RuleConfiguration applyTemplate(String name, JsonNode override) {
        RuleConfiguration template = template(name);
        if (override == null || override.isNull() || override.isEmpty()) {
            return template;
        }
        RuleConfiguration merged = merge(template, override);
        log.debug("Applied template {} with override, fingerprint {}", name, merged.getFingerprint());
        return merged;
    }

    public RuleConfiguration defaultConfiguration() {
        return template(properties.getDefaultTemplate());
    }

    /**
     * The configuration given inline, else the named template, else the default template.
     */
    public RuleConfiguration resolve(JsonNode inline, String templateName) {
        if (inline != null && !inline.isNull()) {
            return validator.validate(inline);
        }
        if (templateName != null && !templateName.isBlank()) {
            return template(templateName);
        }
        return defaultConfiguration();
    }

    public String serialize(RuleConfiguration config) {
        return codec.toJson(config);
    }

    public JsonNode toDocument(RuleConfiguration config) {
        return codec.toTree(config);
    }
}
