package xyz.firestige.netops.validation;

/**
 * 校验警告，不阻止运行
 */
public class ValidationWarning {

    private final String deviceName;

    private final String message;

    public ValidationWarning(String deviceName, String message) {
        this.deviceName = deviceName;
        this.message = message;
    }

    public String getDeviceName() {
        return deviceName;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "ValidationWarning{device='" + deviceName + "', message='" + message + "'}";
    }
}
