package com.layergen.oracle;

import com.layergen.prompt.OracleRequest;

/**
 * Synchronous text-generation capability. One call is one attempt; retrying is the caller's job.
 */
public interface CodeOracle {

    /**
     * Send a request and return the raw response text.
     *
     * @param request rendered request
     * @return raw response content, including markdown fences
     * @throws OracleUnavailableException on network errors, timeouts and server errors
     * @throws OracleRateLimitedException when the quota is exceeded
     * @throws OracleRejectedException when the request or credentials are refused
     * @throws MalformedResponseException when the response envelope cannot be read
     */
    String complete(OracleRequest request);

    default boolean isEnabled() {
        return true;
    }
}
