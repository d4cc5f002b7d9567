package xyz.firestige.netops.execution.retry;

import java.time.Duration;

/**
 * 固定间隔重试
 * <p>
 * 对应 {@code netops.retry.strategy=FIXED}，默认 3 次尝试、间隔 2 秒。
 */
public class FixedDelayRetryStrategy implements RetryStrategy {

    private final int maxAttempts;
    private final Duration delay;

    public FixedDelayRetryStrategy(int maxAttempts, Duration delay) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts 必须大于 0: " + maxAttempts);
        }
        if (delay == null || delay.isNegative()) {
            throw new IllegalArgumentException("重试间隔不能为负: " + delay);
        }
        this.maxAttempts = maxAttempts;
        this.delay = delay;
    }

    @Override
    public Duration nextDelay(int attempt, Throwable lastError) {
        if (attempt >= maxAttempts || !isRetryable(lastError)) {
            return null;
        }
        return delay;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getDelay() {
        return delay;
    }
}
