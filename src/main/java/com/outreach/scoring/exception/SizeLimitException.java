package com.outreach.scoring.exception;

/**
 * Request body exceeded the configured ceiling; raised before the body is parsed.
 */
public class SizeLimitException extends RuntimeException {

    private final long size;
    private final long limit;

    public SizeLimitException(long size, long limit) {
        super(String.format("Request too large: %d bytes exceeds limit of %d bytes", size, limit));
        this.size = size;
        this.limit = limit;
    }

    public long getSize() {
        return size;
    }

    public long getLimit() {
        return limit;
    }
}
