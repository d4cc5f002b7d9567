package xyz.firestige.netops.validation;

/**
 * 校验错误（结构性违规）
 */
public class ValidationError {

    /**
     * 违规所在设备，跨设备错误为 null
     */
    private final String deviceName;

    /**
     * 错误字段，如 interfaces[0].address
     */
    private final String field;

    private final String message;

    private final String errorCode;

    private final Object rejectedValue;

    public ValidationError(String deviceName, String field, String message, String errorCode, Object rejectedValue) {
        this.deviceName = deviceName;
        this.field = field;
        this.message = message;
        this.errorCode = errorCode;
        this.rejectedValue = rejectedValue;
    }

    public static ValidationError of(String deviceName, String field, String errorCode, String message) {
        return new ValidationError(deviceName, field, message, errorCode, null);
    }

    public static ValidationError of(String deviceName, String field, String errorCode, String message, Object rejectedValue) {
        return new ValidationError(deviceName, field, message, errorCode, rejectedValue);
    }

    public String getDeviceName() {
        return deviceName;
    }

    public String getField() {
        return field;
    }

    public String getMessage() {
        return message;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public Object getRejectedValue() {
        return rejectedValue;
    }

    @Override
    public String toString() {
        return "ValidationError{" +
                "device='" + deviceName + '\'' +
                ", field='" + field + '\'' +
                ", errorCode='" + errorCode + '\'' +
                ", message='" + message + '\'' +
                ", rejectedValue=" + rejectedValue +
                '}';
    }
}
