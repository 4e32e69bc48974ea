package com.layergen.oracle;

/**
 * The oracle answered, but not with exactly one non-empty fenced code block. Retrying the same
 * request is not expected to help.
 */
public class MalformedResponseException extends CodeSynthesisException {
    public MalformedResponseException(String message) {
        super(message);
    }

    public MalformedResponseException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getFailureKind() {
        return "MALFORMED_RESPONSE";
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
