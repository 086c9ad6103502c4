package com.easycashflows.service.ai;

import lombok.extern.slf4j.Slf4j;

import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Bounded exponential backoff. Retry number {@code n} (0-based) waits {@code min(baseDelay * 2^n, maxDelay)}.
 * Only failures accepted by the {@code retryable} predicate are retried; anything else is rethrown at once.
 */
@Slf4j
public class RetryPolicy {

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final int maxAttempts;
    private final long baseDelayMs;
    private final long maxDelayMs;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts, long baseDelayMs, long maxDelayMs) {
        this(maxAttempts, baseDelayMs, maxDelayMs, Thread::sleep);
    }

    public RetryPolicy(int maxAttempts, long baseDelayMs, long maxDelayMs, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (baseDelayMs < 0 || maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("delays must satisfy 0 <= baseDelay <= maxDelay");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.sleeper = sleeper;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public long delayBeforeRetry(int retryNumber) {
        if (retryNumber >= 62) {
            return maxDelayMs;
        }
        long delay = baseDelayMs * (1L << retryNumber);
        return delay < 0 ? maxDelayMs : Math.min(delay, maxDelayMs);
    }

    public <T> T execute(Supplier<T> call, Predicate<RuntimeException> retryable) {
        for (int attempt = 1; ; attempt++) {
            try {
                return call.get();
            } catch (RuntimeException e) {
                if (attempt >= maxAttempts || !retryable.test(e)) {
                    throw e;
                }
                long waitMs = delayBeforeRetry(attempt - 1);
                log.info("Retryable failure, retrying in {}ms (attempt {}/{}): {}",
                        waitMs, attempt, maxAttempts, e.getMessage());
                pause(waitMs, e);
            }
        }
    }

    private void pause(long waitMs, RuntimeException cause) {
        try {
            sleeper.sleep(waitMs);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            cause.addSuppressed(interrupted);
            throw cause;
        }
    }
}
