package xyz.firestige.netops.domain.outcome;

import java.time.Duration;
import java.util.Objects;

import xyz.firestige.netops.exception.FailureInfo;

/**
 * 某阶段中单台设备的终态结果，记录后不可变
 * <p>
 * 三种形态：
 * <ul>
 *   <li>SUCCEEDED：动作成功</li>
 *   <li>FAILED：动作失败，附带 {@link FailureInfo}</li>
 *   <li>SKIPPED：动作未开始，附带 {@link SkipCause}</li>
 * </ul>
 */
public final class DeviceOutcome {

    private final String phase;
    private final String deviceName;
    private final OutcomeStatus status;
    private final FailureInfo failure;
    private final SkipCause skipCause;
    private final int attempts;
    private final Duration duration;
    private final String detail;

    private DeviceOutcome(String phase, String deviceName, OutcomeStatus status, FailureInfo failure,
                          SkipCause skipCause, int attempts, Duration duration, String detail) {
        this.phase = Objects.requireNonNull(phase, "phase");
        this.deviceName = Objects.requireNonNull(deviceName, "deviceName");
        this.status = status;
        this.failure = failure;
        this.skipCause = skipCause;
        this.attempts = attempts;
        this.duration = duration != null ? duration : Duration.ZERO;
        this.detail = detail;
    }

    public static DeviceOutcome succeeded(String phase, String deviceName, int attempts, Duration duration, String detail) {
        return new DeviceOutcome(phase, deviceName, OutcomeStatus.SUCCEEDED, null, null, attempts, duration, detail);
    }

    public static DeviceOutcome failed(String phase, String deviceName, FailureInfo failure, int attempts, Duration duration) {
        Objects.requireNonNull(failure, "failure");
        return new DeviceOutcome(phase, deviceName, OutcomeStatus.FAILED, failure.at(phase), null, attempts, duration,
                failure.getErrorMessage());
    }

    public static DeviceOutcome skipped(String phase, String deviceName, SkipCause cause) {
        Objects.requireNonNull(cause, "cause");
        return new DeviceOutcome(phase, deviceName, OutcomeStatus.SKIPPED, null, cause, 0, Duration.ZERO, cause.getCode());
    }

    public boolean isSucceeded() {
        return status == OutcomeStatus.SUCCEEDED;
    }

    public boolean isFailed() {
        return status == OutcomeStatus.FAILED;
    }

    public boolean isSkipped() {
        return status == OutcomeStatus.SKIPPED;
    }

    /**
     * 失败原因；非失败结果返回 null
     */
    public String getReason() {
        return failure != null ? failure.getErrorMessage() : null;
    }

    public String getPhase() {
        return phase;
    }

    public String getDeviceName() {
        return deviceName;
    }

    public OutcomeStatus getStatus() {
        return status;
    }

    public FailureInfo getFailure() {
        return failure;
    }

    public SkipCause getSkipCause() {
        return skipCause;
    }

    public int getAttempts() {
        return attempts;
    }

    public Duration getDuration() {
        return duration;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        switch (status) {
            case FAILED:
                return String.format("Failed[%s/%s: %s]", phase, deviceName, getReason());
            case SKIPPED:
                return String.format("Skipped[%s/%s: %s]", phase, deviceName, skipCause.getCode());
            default:
                return String.format("Succeeded[%s/%s]", phase, deviceName);
        }
    }
}
