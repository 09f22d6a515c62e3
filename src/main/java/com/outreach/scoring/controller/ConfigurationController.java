package com.outreach.scoring.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.outreach.scoring.model.config.MergeRequest;
import com.outreach.scoring.model.config.RuleConfiguration;
import com.outreach.scoring.service.RuleConfigurationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/configurations")
@Tag(name = "Configurations", description = "Validate, merge and template rule configurations")
public class ConfigurationController {

    private final RuleConfigurationService configurationService;

    public ConfigurationController(RuleConfigurationService configurationService) {
        this.configurationService = configurationService;
    }

    @Operation(summary = "Validate a rule configuration",
            description = "Returns the normalized configuration and its fingerprint. Unknown or malformed fields " +
                    "are rejected with 400 and every violation, each qualified by its field path.")
    @PostMapping("/validate")
    public ResponseEntity<Map<String, Object>> validate(@RequestBody JsonNode document) {
        return ResponseEntity.ok(view(configurationService.validate(document)));
    }

    @Operation(summary = "Deep-merge an override onto a base configuration",
            description = "The base is either an inline document or a built-in template. The merged result is validated.")
    @PostMapping("/merge")
    public ResponseEntity<?> merge(@RequestBody MergeRequest request) {
        RuleConfiguration merged;
        if (request.getBase() != null && !request.getBase().isNull()) {
            merged = configurationService.merge(request.getBase(), request.getOverride());
        } else if (request.getBaseTemplate() != null && !request.getBaseTemplate().isBlank()) {
            merged = configurationService.applyTemplate(request.getBaseTemplate(), request.getOverride());
        } else {
            return ResponseEntity.badRequest().body(Map.of("error", "base or baseTemplate is required", "field", "base"));
        }
        return ResponseEntity.ok(view(merged));
    }

    @Operation(summary = "List built-in template names")
    @GetMapping("/templates")
    public ResponseEntity<List<String>> listTemplates() {
        return ResponseEntity.ok(configurationService.templateNames());
    }

    @Operation(summary = "Get a built-in template")
    @GetMapping("/templates/{name}")
    public ResponseEntity<Map<String, Object>> getTemplate(
            @Parameter(description = "Template name", example = "italy_hydraulics")
            @PathVariable String name) {
        return ResponseEntity.ok(view(configurationService.template(name)));
    }

    @Operation(summary = "Apply a template with an optional partial override")
    @PostMapping("/templates/{name}/apply")
    public ResponseEntity<Map<String, Object>> applyTemplate(
            @Parameter(description = "Template name", example = "germany_manufacturing")
            @PathVariable String name,
            @RequestBody(required = false) JsonNode override) {
        return ResponseEntity.ok(view(configurationService.applyTemplate(name, override)));
    }

    private Map<String, Object> view(RuleConfiguration config) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("fingerprint", config.getFingerprint());
        body.put("configuration", configurationService.toDocument(config));
        return body;
    }
}
