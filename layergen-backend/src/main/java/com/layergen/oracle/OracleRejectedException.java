package com.layergen.oracle;

/**
 * The oracle rejected the request itself (missing or invalid credentials, bad request). Not retried.
 */
public class OracleRejectedException extends CodeSynthesisException {
    public OracleRejectedException(String message) {
        super(message);
    }

    @Override
    public String getFailureKind() {
        return "ORACLE_REJECTED";
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
