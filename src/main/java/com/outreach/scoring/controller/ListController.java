package com.outreach.scoring.controller;

import com.outreach.scoring.model.bulk.BulkUpdateRequest;
import com.outreach.scoring.model.bulk.BulkUpdateResponse;
import com.outreach.scoring.model.bulk.ListEntry;
import com.outreach.scoring.service.BulkMutationService;
import com.outreach.scoring.service.BulkRequestReader;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.util.List;

@RestController
@RequestMapping("/api/v1/lists")
@Tag(name = "Lists", description = "Stored contact-list metadata and bulk field updates")
public class ListController {

    private final BulkMutationService bulkMutationService;
    private final BulkRequestReader requestReader;

    public ListController(BulkMutationService bulkMutationService, BulkRequestReader requestReader) {
        this.bulkMutationService = bulkMutationService;
        this.requestReader = requestReader;
    }

    @Operation(summary = "Bulk-update list metadata",
            description = "Applies one patch (country, category, priority, processed, description, display_name) " +
                    "to many lists. Malformed requests are rejected with 400 before any list is read; bodies over " +
                    "the size ceiling get 413 before parsing. Missing lists are per-target failures; when none " +
                    "exist the response is 404 and nothing is written.",
            requestBody = @io.swagger.v3.oas.annotations.parameters.RequestBody(
                    content = @Content(schema = @Schema(implementation = BulkUpdateRequest.class))))
    @PostMapping(value = "/bulk-update", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<BulkUpdateResponse> bulkUpdate(HttpServletRequest request) throws IOException {
        BulkUpdateRequest parsed = requestReader.read(request.getInputStream(), request.getContentLengthLong());
        return ResponseEntity.ok(bulkMutationService.process(parsed));
    }

    @Operation(summary = "List all stored lists")
    @GetMapping
    public ResponseEntity<List<ListEntry>> listAll() {
        return ResponseEntity.ok(bulkMutationService.listAll());
    }

    @Operation(summary = "Get one stored list by file name")
    @GetMapping("/{filename}")
    public ResponseEntity<ListEntry> getList(
            @Parameter(description = "List file name", example = "italy_hydraulics.lvp")
            @PathVariable String filename) {
        return bulkMutationService.find(filename)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}
