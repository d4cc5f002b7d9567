package xyz.firestige.netops.exception;

import java.time.Duration;

/**
 * 设备动作超时，按连接类错误参与重试
 * <p>
 * 被放弃的尝试在宽限期内仍未结束时 {@link #isAttemptStillRunning()} 为 true，
 * 此时不得再发起新尝试，否则同一设备上会出现并行会话。
 */
public class DeviceTimeoutException extends ConnectionException {

    private final Duration timeout;
    private final boolean attemptStillRunning;

    public DeviceTimeoutException(String deviceName, Duration timeout) {
        this(deviceName, timeout, false);
    }

    public DeviceTimeoutException(String deviceName, Duration timeout, boolean attemptStillRunning) {
        super(ErrorType.TIMEOUT_ERROR, "设备动作超时: " + deviceName + ", 超时时间 " + timeout.toMillis() + "ms"
                + (attemptStillRunning ? ", 原尝试仍未结束" : ""), null);
        this.timeout = timeout;
        this.attemptStillRunning = attemptStillRunning;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public boolean isAttemptStillRunning() {
        return attemptStillRunning;
    }
}
