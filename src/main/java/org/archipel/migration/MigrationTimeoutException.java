package org.archipel.migration;

import java.time.Duration;

/**
 * Thrown when a blocking immigration receives no migrants within its timeout. This usually
 * means the populations wait for each other.
 */
public class MigrationTimeoutException extends RuntimeException {

    private final Duration timeout;

    public MigrationTimeoutException(Duration timeout) {
        super(String.format("immigration timed out after %dms", timeout.toMillis()));
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
