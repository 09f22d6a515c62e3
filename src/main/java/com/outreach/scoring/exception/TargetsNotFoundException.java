package com.outreach.scoring.exception;

import com.outreach.scoring.model.bulk.BulkUpdateResponse;

/**
 * Every target of a bulk update was missing from the store, so nothing was written.
 */
public class TargetsNotFoundException extends RuntimeException {

    private final transient BulkUpdateResponse response;

    public TargetsNotFoundException(BulkUpdateResponse response) {
        super("None of the " + response.getFailed() + " requested lists were found");
        this.response = response;
    }

    public BulkUpdateResponse getResponse() {
        return response;
    }
}
