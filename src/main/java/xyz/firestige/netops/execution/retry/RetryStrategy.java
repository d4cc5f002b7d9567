package xyz.firestige.netops.execution.retry;

import java.time.Duration;

import xyz.firestige.netops.exception.ConnectionException;

/**
 * 设备动作重试策略
 * <p>
 * 只有连接类失败（连接失败、会话中断、单次尝试超时）才进入重试；命令被设备拒绝、
 * 驱动缺失等错误由 {@link #isRetryable(Throwable)} 拦下，直接记为失败。
 */
@FunctionalInterface
public interface RetryStrategy {

    /**
     * 决定下次重试的延迟时间
     *
     * @param attempt   当前已完成的尝试次数（从 1 开始）
     * @param lastError 上次错误
     * @return 延迟时间，null 表示停止重试
     */
    Duration nextDelay(int attempt, Throwable lastError);

    /**
     * 该错误是否允许重试
     */
    default boolean isRetryable(Throwable error) {
        return error instanceof ConnectionException;
    }

    /**
     * 不重试
     */
    static RetryStrategy none() {
        return (attempt, lastError) -> null;
    }
}
