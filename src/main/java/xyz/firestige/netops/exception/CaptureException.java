package xyz.firestige.netops.exception;

/**
 * 备份采集失败，历史与 latest 指针保持不变
 */
public class CaptureException extends NetOpsException {

    public CaptureException(String message) {
        super(ErrorType.CAPTURE_ERROR, message);
    }

    public CaptureException(String message, Throwable cause) {
        super(ErrorType.CAPTURE_ERROR, message, cause);
    }
}
