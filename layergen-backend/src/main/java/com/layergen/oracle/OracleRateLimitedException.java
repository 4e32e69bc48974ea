package com.layergen.oracle;

import java.time.Duration;

/**
 * The oracle refused the call because a request or token quota was exceeded (HTTP 429).
 */
public class OracleRateLimitedException extends CodeSynthesisException {
    private final transient Duration retryAfter;

    public OracleRateLimitedException(String message, Duration retryAfter) {
        super(message);
        this.retryAfter = retryAfter;
    }

    /**
     * Delay requested by the oracle, or {@code null} when it sent none.
     */
    public Duration getRetryAfter() {
        return retryAfter;
    }

    @Override
    public String getFailureKind() {
        return "ORACLE_RATE_LIMITED";
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
