package xyz.firestige.netops.domain.outcome;

/**
 * 设备动作未执行的原因
 */
public enum SkipCause {

    /**
     * 运行级取消信号已发出，动作尚未开始
     */
    CANCELLED("cancelled"),

    /**
     * 前驱阶段执行器本身崩溃（不是设备级失败）
     */
    PREDECESSOR_CRASHED("predecessor-crashed");

    private final String code;

    SkipCause(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
