package com.intelmonitor.worker;

import com.intelmonitor.config.WorkerConfig;
import com.intelmonitor.exception.BaseException;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import org.springframework.stereotype.Component;

/**
 * Exponential backoff with full jitter: the delay before retry {@code n} (0-based) is
 * uniform in [0, min(maxBackoff, base * 2^n)].
 *
 * <p>Engine exceptions carry their own retryability; anything else is treated as transient.
 */
@Component
public class RetryPolicy {

    private final WorkerConfig workerConfig;

    public RetryPolicy(WorkerConfig workerConfig) {
        this.workerConfig = workerConfig;
    }

    /**
     * @param failedAttempts attempts made so far, including the one that just failed
     */
    public boolean shouldRetry(int failedAttempts, Throwable error) {
        if (failedAttempts >= workerConfig.getMaxRetries()) {
            return false;
        }
        return isRetryable(error);
    }

    public boolean isRetryable(Throwable error) {
        if (error instanceof BaseException baseException) {
            return baseException.isRetryable();
        }
        return true;
    }

    /** Upper bound of the delay for retry {@code retryIndex}. */
    public Duration maxDelay(int retryIndex) {
        long base = workerConfig.getBaseBackoffSeconds();
        long ceiling = workerConfig.getMaxBackoffSeconds();
        // 2^n overflows long past n = 62; the ceiling applies long before that
        long exponential = retryIndex >= 30 ? ceiling : base * (1L << retryIndex);
        return Duration.ofSeconds(Math.min(ceiling, exponential));
    }

    public Duration nextDelay(int retryIndex) {
        long capMillis = maxDelay(retryIndex).toMillis();
        return Duration.ofMillis(ThreadLocalRandom.current().nextLong(capMillis + 1));
    }
}
