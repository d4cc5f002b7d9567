package xyz.firestige.netops.exception;

import java.util.HashMap;
import java.util.Map;

/**
 * 编排引擎基础异常类
 * 所有设备级、运行级异常的基类
 */
public class NetOpsException extends RuntimeException {

    private final ErrorType errorType;

    private String errorCode;

    /**
     * 上下文信息（设备名、阶段名等）
     */
    private final Map<String, Object> context = new HashMap<>();

    public NetOpsException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
        this.errorCode = errorType.name();
    }

    public NetOpsException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
        this.errorCode = errorType.name();
    }

    /**
     * 添加上下文信息
     */
    public NetOpsException addContext(String key, Object value) {
        this.context.put(key, value);
        return this;
    }

    /**
     * 转换为 FailureInfo
     */
    public FailureInfo toFailureInfo() {
        return FailureInfo.fromException(this, (String) context.get("phase"));
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public void setErrorCode(String errorCode) {
        this.errorCode = errorCode;
    }

    public boolean isRetryable() {
        return errorType.isRetryable();
    }

    public Map<String, Object> getContext() {
        return context;
    }
}
