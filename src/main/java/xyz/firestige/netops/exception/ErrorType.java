package xyz.firestige.netops.exception;

/**
 * 错误类型枚举
 * 用于区分设备级失败与运行级失败，并决定是否可以重试
 */
public enum ErrorType {

    /**
     * 预检校验错误（整个运行中止）
     */
    VALIDATION_ERROR("校验错误", false),

    /**
     * 连接错误（瞬时，可重试）
     */
    CONNECTION_ERROR("连接错误", true),

    /**
     * 超时错误（按连接类错误处理）
     */
    TIMEOUT_ERROR("超时错误", true),

    /**
     * 设备拒绝命令（不重试）
     */
    COMMAND_REJECTED("命令被拒绝", false),

    /**
     * 备份采集失败
     */
    CAPTURE_ERROR("备份采集错误", false),

    /**
     * 运行被取消
     */
    CANCELLED("已取消", false),

    /**
     * 阶段图配置错误（构建时致命）
     */
    ORCHESTRATOR_CONFIG_ERROR("编排配置错误", false),

    /**
     * 系统错误
     */
    SYSTEM_ERROR("系统错误", false);

    private final String description;
    private final boolean retryable;

    ErrorType(String description, boolean retryable) {
        this.description = description;
        this.retryable = retryable;
    }

    public String getDescription() {
        return description;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
