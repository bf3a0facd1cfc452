package com.proofsmith.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Capped retry with exponential backoff for provider calls.
 *
 * At most {@code maxAttempts} calls are made. Between call i and i+1 the policy sleeps
 * {@code baseDelayMs * 2^(i-1)}. After the last failed call the failure is rethrown as
 * {@link LLMTransportException}; nothing is retried past the budget.
 *
 * There is no cooperative cancellation: a hung call is only abandoned when the
 * underlying client times out.
 */
@Component
public class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final int     maxAttempts;
    private final long    baseDelayMs;
    private final Sleeper sleeper;

    @Autowired
    public RetryPolicy(
            @Value("${proofsmith.llm.max-retries:3}") int maxAttempts,
            @Value("${proofsmith.llm.retry-delay-ms:1000}") long baseDelayMs
    ) {
        this(maxAttempts, baseDelayMs, Thread::sleep);
    }

    public RetryPolicy(int maxAttempts, long baseDelayMs, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.baseDelayMs = Math.max(0, baseDelayMs);
        this.sleeper     = sleeper;
    }

    public <T> T execute(String operation, Supplier<T> call) {

        int attempt = 0;

        while (true) {
            attempt++;
            try {
                T result = call.get();
                if (attempt > 1) {
                    log.info("[Retry] {} succeeded | retries={}", operation, attempt - 1);
                }
                return result;

            } catch (RuntimeException ex) {

                if (attempt >= maxAttempts) {
                    log.error("[Retry] {} final failure | attempts={}", operation, attempt, ex);
                    throw new LLMTransportException(
                            operation + " failed after " + attempt + " attempt(s): " + rootMessage(ex), ex);
                }

                long backoff = computeBackoff(attempt);
                log.warn("[Retry] {} transient failure on attempt {}/{}. Retrying after {} ms. Cause: {}",
                        operation, attempt, maxAttempts, backoff, rootMessage(ex));

                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new LLMTransportException(operation + " interrupted during backoff", ie);
                }
            }
        }
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    long computeBackoff(int attempt) {
        return baseDelayMs * (1L << (attempt - 1));
    }

    private static String rootMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage();
    }
}
