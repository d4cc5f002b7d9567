package xyz.firestige.netops.execution.retry;

import java.time.Duration;

/**
 * 指数退避重试
 * <p>
 * 第 n 次失败后等待 {@code initialDelay * multiplier^(n-1)}，不超过 {@code maxDelay}。
 * 适合设备批量重启、管理面短时不可达的场景。
 */
public class ExponentialBackoffRetryStrategy implements RetryStrategy {

    private static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(30);

    private final int maxAttempts;
    private final Duration initialDelay;
    private final double multiplier;
    private final Duration maxDelay;

    public ExponentialBackoffRetryStrategy(int maxAttempts, Duration initialDelay, double multiplier, Duration maxDelay) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts 必须大于 0: " + maxAttempts);
        }
        if (initialDelay == null || initialDelay.isNegative() || initialDelay.isZero()) {
            throw new IllegalArgumentException("初始间隔必须为正: " + initialDelay);
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("退避倍数不能小于 1: " + multiplier);
        }
        this.maxAttempts = maxAttempts;
        this.initialDelay = initialDelay;
        this.multiplier = multiplier;
        this.maxDelay = maxDelay != null ? maxDelay : DEFAULT_MAX_DELAY;
    }

    @Override
    public Duration nextDelay(int attempt, Throwable lastError) {
        if (attempt >= maxAttempts || !isRetryable(lastError)) {
            return null;
        }
        long capMillis = maxDelay.toMillis();
        double millis = initialDelay.toMillis();
        // 逐次相乘，到上限即停，避免大 attempt 时溢出
        for (int i = 1; i < attempt && millis < capMillis; i++) {
            millis *= multiplier;
        }
        return Duration.ofMillis((long) Math.min(millis, capMillis));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public double getMultiplier() {
        return multiplier;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }
}
