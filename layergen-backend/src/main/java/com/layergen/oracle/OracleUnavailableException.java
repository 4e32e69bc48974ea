package com.layergen.oracle;

/**
 * The oracle could not be reached, timed out, or answered with a server error.
 */
public class OracleUnavailableException extends CodeSynthesisException {
    public OracleUnavailableException(String message) {
        super(message);
    }

    public OracleUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getFailureKind() {
        return "ORACLE_UNAVAILABLE";
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
