package xyz.firestige.netops.report;

import xyz.firestige.netops.domain.outcome.DeviceOutcome;
import xyz.firestige.netops.domain.outcome.OutcomeStatus;
import xyz.firestige.netops.exception.FailureInfo;

/**
 * 报告中的一行：一个 (阶段, 设备) 的结果
 */
public class ReportEntry {

    private final String phase;
    private final String device;
    private final OutcomeStatus status;
    private final String reason;
    private final String errorCode;
    private final int attempts;
    private final long durationMillis;
    private final String detail;

    public ReportEntry(String phase, String device, OutcomeStatus status, String reason,
                       String errorCode, int attempts, long durationMillis, String detail) {
        this.phase = phase;
        this.device = device;
        this.status = status;
        this.reason = reason;
        this.errorCode = errorCode;
        this.attempts = attempts;
        this.durationMillis = durationMillis;
        this.detail = detail;
    }

    public static ReportEntry from(DeviceOutcome outcome) {
        FailureInfo failure = outcome.getFailure();
        return new ReportEntry(
                outcome.getPhase(),
                outcome.getDeviceName(),
                outcome.getStatus(),
                outcome.getReason(),
                failure != null ? failure.getErrorCode() : null,
                outcome.getAttempts(),
                outcome.getDuration() != null ? outcome.getDuration().toMillis() : 0L,
                outcome.getDetail());
    }

    public String getPhase() {
        return phase;
    }

    public String getDevice() {
        return device;
    }

    public OutcomeStatus getStatus() {
        return status;
    }

    public String getReason() {
        return reason;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public int getAttempts() {
        return attempts;
    }

    public long getDurationMillis() {
        return durationMillis;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        return phase + "/" + device + ": " + status + (reason != null ? " (" + reason + ")" : "");
    }
}
