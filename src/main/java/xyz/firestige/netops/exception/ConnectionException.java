package xyz.firestige.netops.exception;

/**
 * 连接类错误：会话建立失败、传输中断等，属于可重试的瞬时错误
 */
public class ConnectionException extends NetOpsException {

    public ConnectionException(String message) {
        super(ErrorType.CONNECTION_ERROR, message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(ErrorType.CONNECTION_ERROR, message, cause);
    }

    protected ConnectionException(ErrorType errorType, String message, Throwable cause) {
        super(errorType, message, cause);
    }
}
