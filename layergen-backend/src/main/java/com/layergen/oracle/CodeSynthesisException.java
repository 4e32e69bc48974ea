package com.layergen.oracle;

/**
 * Base class of every failure raised while obtaining code from the oracle.
 */
public abstract class CodeSynthesisException extends RuntimeException {
    private int attempts;

    protected CodeSynthesisException(String message) {
        super(message);
    }

    protected CodeSynthesisException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Short, stable failure category used in reports, e.g. {@code ORACLE_UNAVAILABLE}.
     */
    public abstract String getFailureKind();

    /**
     * Whether another attempt could succeed.
     */
    public abstract boolean isRetryable();

    /**
     * Oracle calls made before the failure was surfaced; 0 if not recorded.
     */
    public int getAttempts() {
        return attempts;
    }

    CodeSynthesisException withAttempts(int attempts) {
        this.attempts = attempts;
        return this;
    }
}
