package com.ardesk.collections.exception;

import java.time.Duration;

public class EngineTimeoutException extends RuntimeException {

    public EngineTimeoutException(String tenantId, Duration timeout) {
        super("Computation for tenant " + tenantId + " did not finish within " + timeout);
    }
}
