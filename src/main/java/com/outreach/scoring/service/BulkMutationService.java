package com.outreach.scoring.service;

import com.outreach.scoring.config.MetricsConfig;
import com.outreach.scoring.exception.TargetsNotFoundException;
import com.outreach.scoring.exception.ValidationException;
import com.outreach.scoring.model.bulk.BulkPatch;
import com.outreach.scoring.model.bulk.BulkUpdateRequest;
import com.outreach.scoring.model.bulk.BulkUpdateResponse;
import com.outreach.scoring.model.bulk.ListCatalog;
import com.outreach.scoring.model.bulk.ListEntry;
import com.outreach.scoring.model.bulk.PatchField;
import com.outreach.scoring.model.bulk.RequestState;
import com.outreach.scoring.model.bulk.TargetResult;
import com.outreach.scoring.repository.ListStore;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Applies one sparse field patch to many stored lists.
 *
 * Request lifecycle: RECEIVED -> VALIDATED -> APPLIED | PARTIAL | REJECTED.
 * Validation happens before the store is touched. Missing targets are per-target failures;
 * the store is rewritten only when at least one target was updated. Load-modify-write runs
 * under a single lock so concurrent requests cannot lose each other's updates.
 */
@Service
public class BulkMutationService {

    private static final Logger log = LoggerFactory.getLogger(BulkMutationService.class);

    static final String NOT_FOUND = "List not found";

    private final ListStore listStore;
    private final IdentifierValidator identifierValidator;
    private final MetricsConfig metricsConfig;
    private final ReentrantLock writeLock = new ReentrantLock();

    public BulkMutationService(ListStore listStore, IdentifierValidator identifierValidator,
                               MetricsConfig metricsConfig) {
        this.listStore = listStore;
        this.identifierValidator = identifierValidator;
        this.metricsConfig = metricsConfig;
    }

    /**
     * Validate and apply a request.
     *
     * @throws ValidationException      request rejected before any stored data was read
     * @throws TargetsNotFoundException none of the targets exist; nothing was written
     */
    @Observed(name = "bulk.process", contextualName = "bulk-update")
    public BulkUpdateResponse process(BulkUpdateRequest request) {
        log.debug("Bulk update {}: {} identifier(s)", RequestState.RECEIVED,
                request == null || request.getIdentifiers() == null ? 0 : request.getIdentifiers().size());
        BulkPatch patch;
        try {
            patch = validate(request);
            log.debug("Bulk update {}: fields={}", RequestState.VALIDATED, patch.getFields().keySet());
        } catch (ValidationException e) {
            log.warn("Bulk update rejected: {} ({})", e.getMessage(), e.getField());
            metricsConfig.recordBulkUpdate(RequestState.REJECTED, 0, 0);
            throw e;
        }
        try {
            BulkUpdateResponse response = apply(patch);
            metricsConfig.recordBulkUpdate(response.getState(), response.getUpdated(), response.getFailed());
            return response;
        } catch (TargetsNotFoundException e) {
            metricsConfig.recordBulkUpdate(RequestState.REJECTED, 0, e.getResponse().getFailed());
            throw e;
        }
    }

    /**
     * Shape, whitelist, type/range and identifier checks. Duplicate identifiers are collapsed.
     */
    public BulkPatch validate(BulkUpdateRequest request) {
        if (request == null) {
            throw new ValidationException("body", "Request body is required");
        }
        if (request.getIdentifiers() == null || request.getIdentifiers().isEmpty()) {
            throw new ValidationException("identifiers", "identifiers array is empty");
        }
        if (request.getPatch() == null || request.getPatch().isEmpty()) {
            throw new ValidationException("patch", "patch object is empty");
        }

        Map<PatchField, Object> fields = new EnumMap<>(PatchField.class);
        for (Map.Entry<String, Object> entry : request.getPatch().entrySet()) {
            PatchField field = PatchField.fromWireName(entry.getKey())
                    .orElseThrow(() -> new ValidationException("patch." + entry.getKey(),
                            "Field '" + entry.getKey() + "' is not allowed for update"));
            fields.put(field, field.validate(entry.getValue()));
        }

        Set<String> identifiers = new LinkedHashSet<>();
        List<Object> raw = request.getIdentifiers();
        for (int i = 0; i < raw.size(); i++) {
            identifiers.add(identifierValidator.validate(raw.get(i), "identifiers[" + i + "]"));
        }

        return new BulkPatch(List.copyOf(identifiers), Collections.unmodifiableMap(fields));
    }

    /**
     * Apply a validated patch to the store.
     *
     * @throws TargetsNotFoundException when no target exists; the store is not written
     */
    public BulkUpdateResponse apply(BulkPatch patch) {
        writeLock.lock();
        try {
            ListCatalog catalog = listStore.load();
            List<TargetResult> results = new ArrayList<>();
            List<String> errors = new ArrayList<>();
            int updated = 0;

            for (String identifier : patch.getIdentifiers()) {
                Optional<ListEntry> entry = catalog.find(identifier);
                if (entry.isEmpty()) {
                    results.add(TargetResult.failed(identifier, NOT_FOUND));
                    errors.add(NOT_FOUND + ": " + identifier);
                    log.warn("{}: {}", NOT_FOUND, identifier);
                    continue;
                }
                patch.getFields().forEach(entry.get()::apply);
                results.add(TargetResult.ok(identifier));
                updated++;
            }

            int failed = results.size() - updated;
            BulkUpdateResponse response = BulkUpdateResponse.builder()
                    .success(failed == 0)
                    .updated(updated)
                    .failed(failed)
                    .errors(errors)
                    .results(results)
                    .build();

            if (updated == 0) {
                response.setState(RequestState.REJECTED);
                throw new TargetsNotFoundException(response);
            }

            listStore.save(catalog);
            response.setState(failed == 0 ? RequestState.APPLIED : RequestState.PARTIAL);
            log.info("Bulk update {}: {} updated, {} failed, fields={}",
                    response.getState(), updated, failed, patch.getFields().keySet());
            return response;
        } finally {
            writeLock.unlock();
        }
    }

    public List<ListEntry> listAll() {
        return listStore.load().getLists();
    }

    public Optional<ListEntry> find(String filename) {
        return listStore.load().find(filename);
    }
}
