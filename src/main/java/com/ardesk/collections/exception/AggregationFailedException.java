package com.ardesk.collections.exception;

/**
 * Every customer of a non-empty batch failed with a data error.
 */
public class AggregationFailedException extends RuntimeException {

    private final int failedCount;

    public AggregationFailedException(String tenantId, int failedCount) {
        super("All " + failedCount + " customers of tenant " + tenantId + " failed with data errors");
        this.failedCount = failedCount;
    }

    public int getFailedCount() {
        return failedCount;
    }
}
