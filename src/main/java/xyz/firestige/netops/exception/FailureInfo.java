package xyz.firestige.netops.exception;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * 失败信息封装类
 * 统一封装设备动作执行过程中的失败信息，创建后不可变
 */
public final class FailureInfo {

    private final ErrorType errorType;

    private final String errorCode;

    private final String errorMessage;

    /**
     * 失败位置（阶段名称）
     */
    private final String failedAt;

    private final boolean retryable;

    private final LocalDateTime timestamp;

    private FailureInfo(ErrorType errorType, String errorCode, String errorMessage, String failedAt, boolean retryable) {
        this.errorType = Objects.requireNonNull(errorType, "errorType");
        this.errorCode = errorCode != null ? errorCode : errorType.name();
        this.errorMessage = errorMessage != null ? errorMessage : errorType.getDescription();
        this.failedAt = failedAt;
        this.retryable = retryable;
        this.timestamp = LocalDateTime.now();
    }

    public static FailureInfo of(ErrorType errorType, String errorMessage) {
        return new FailureInfo(errorType, null, errorMessage, null, errorType.isRetryable());
    }

    public static FailureInfo of(ErrorType errorType, String errorMessage, String failedAt) {
        return new FailureInfo(errorType, null, errorMessage, failedAt, errorType.isRetryable());
    }

    /**
     * 从异常构造失败信息
     * <p>
     * {@link NetOpsException} 保留自身的错误类型，其他异常一律归为 SYSTEM_ERROR
     */
    public static FailureInfo fromException(Throwable e, String failedAt) {
        if (e instanceof NetOpsException) {
            NetOpsException ne = (NetOpsException) e;
            return new FailureInfo(ne.getErrorType(), ne.getErrorCode(), messageOf(e), failedAt, ne.getErrorType().isRetryable());
        }
        return new FailureInfo(ErrorType.SYSTEM_ERROR, null, messageOf(e), failedAt, false);
    }

    /**
     * 返回一份带失败位置的副本
     */
    public FailureInfo at(String failedAt) {
        return new FailureInfo(errorType, errorCode, errorMessage, failedAt, retryable);
    }

    private static String messageOf(Throwable e) {
        String message = e.getMessage();
        return message != null ? message : e.getClass().getSimpleName();
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String getFailedAt() {
        return failedAt;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return "FailureInfo{" +
                "errorType=" + errorType +
                ", errorCode='" + errorCode + '\'' +
                ", errorMessage='" + errorMessage + '\'' +
                ", failedAt='" + failedAt + '\'' +
                ", retryable=" + retryable +
                ", timestamp=" + timestamp +
                '}';
    }
}
