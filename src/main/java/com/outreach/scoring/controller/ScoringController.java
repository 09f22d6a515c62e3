package com.outreach.scoring.controller;

import com.outreach.scoring.engine.cache.ScoreCache;
import com.outreach.scoring.exception.ValidationException;
import com.outreach.scoring.model.AnomalyReport;
import com.outreach.scoring.model.BatchScoreRequest;
import com.outreach.scoring.model.BatchScoringResult;
import com.outreach.scoring.model.ContactRecord;
import com.outreach.scoring.model.ScoreRequest;
import com.outreach.scoring.model.ScoreResult;
import com.outreach.scoring.model.config.RuleConfiguration;
import com.outreach.scoring.service.BatchScoringService;
import com.outreach.scoring.service.RuleConfigurationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/scoring")
@Tag(name = "Scoring", description = "Score contact records and classify anomalies")
public class ScoringController {

    private final BatchScoringService scoringService;
    private final RuleConfigurationService configurationService;

    public ScoringController(BatchScoringService scoringService, RuleConfigurationService configurationService) {
        this.scoringService = scoringService;
        this.configurationService = configurationService;
    }

    @Operation(summary = "Score a single record",
            description = "Returns the composite score, tier, per-dimension breakdown, applied bonuses/penalties " +
                    "and anomaly flags. Malformed records come back as INVALID_RECORD with score 0.")
    @PostMapping("/score")
    public ResponseEntity<ScoreResult> score(@RequestBody ScoreRequest request) {
        if (request.getRecord() == null) {
            throw new ValidationException("record", "record is required");
        }
        RuleConfiguration config = configurationService.resolve(request.getConfiguration(), request.getTemplate());
        return ResponseEntity.ok(scoringService.score(request.getRecord(), config));
    }

    @Operation(summary = "Score a batch of records",
            description = "Results are in input order; tier counts always sum to the batch size.")
    @PostMapping("/batch")
    public ResponseEntity<BatchScoringResult> scoreBatch(@RequestBody BatchScoreRequest request) {
        if (request.getRecords() == null) {
            throw new ValidationException("records", "records is required");
        }
        RuleConfiguration config = configurationService.resolve(request.getConfiguration(), request.getTemplate());
        BatchScoringResult result = scoringService.scoreAll(request.getRecords(), config);
        return ResponseEntity.ok(result);
    }

    @Operation(summary = "Classify records for anomalies only",
            description = "Runs pattern signatures, neighbor-density and statistical checks without scoring.")
    @PostMapping("/anomalies")
    public ResponseEntity<List<AnomalyReport>> classify(@RequestBody List<ContactRecord> records) {
        for (int i = 0; i < records.size(); i++) {
            if (records.get(i) == null) {
                throw new ValidationException("records[" + i + "]", "record is required");
            }
        }
        return ResponseEntity.ok(scoringService.classifyAll(records));
    }

    @Operation(summary = "Get score cache statistics")
    @GetMapping("/cache")
    public ResponseEntity<ScoreCache.Stats> cacheStats() {
        return ResponseEntity.ok(scoringService.cacheStats());
    }

    @Operation(summary = "Clear the score cache", description = "Returns the statistics from before clearing.")
    @DeleteMapping("/cache")
    public ResponseEntity<ScoreCache.Stats> clearCache() {
        return ResponseEntity.ok(scoringService.clearCache());
    }
}
