package com.layergen.oracle;

import com.layergen.prompt.OracleRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Calls the oracle with retry and turns its answer into source text.
 *
 * <p>Unavailable and rate-limited calls are retried with exponential backoff up to the attempt
 * ceiling. Malformed answers and rejected requests fail immediately.
 */
@Slf4j
@Service
public class CodeSynthesisClient {

    private final CodeOracle oracle;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;

    public CodeSynthesisClient(CodeOracle oracle, RetryPolicy retryPolicy, Sleeper sleeper) {
        this.oracle = oracle;
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
    }

    /**
     * Obtain the code for one request.
     *
     * @param request rendered request
     * @return extracted code and attempt count
     * @throws CodeSynthesisException the last failure, with {@link CodeSynthesisException#getAttempts()} set
     */
    public SynthesisResult synthesize(OracleRequest request) {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                String raw = oracle.complete(request);
                return new SynthesisResult(CodeBlockExtractor.extract(raw), attempt);
            } catch (OracleUnavailableException | OracleRateLimitedException e) {
                if (attempt >= retryPolicy.maxAttempts()) {
                    log.warn("Oracle call failed, giving up: layer={}, attempts={}, kind={}, error={}",
                            request.getLayer(), attempt, e.getFailureKind(), e.getMessage());
                    throw e.withAttempts(attempt);
                }
                Duration delay = e instanceof OracleRateLimitedException
                        ? retryPolicy.delayAfter(attempt, ((OracleRateLimitedException) e).getRetryAfter())
                        : retryPolicy.delayAfter(attempt);
                log.info("Oracle call failed, retrying: layer={}, attempt={}, kind={}, delay_ms={}",
                        request.getLayer(), attempt, e.getFailureKind(), delay.toMillis());
                backoff(delay, attempt);
            } catch (CodeSynthesisException e) {
                log.warn("Oracle call failed without retry: layer={}, attempt={}, kind={}, error={}",
                        request.getLayer(), attempt, e.getFailureKind(), e.getMessage());
                throw e.withAttempts(attempt);
            }
        }
    }

    public boolean isEnabled() {
        return oracle.isEnabled();
    }

    private void backoff(Duration delay, int attempt) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OracleUnavailableException("Interrupted while waiting to retry the oracle", e).withAttempts(attempt);
        }
    }
}
