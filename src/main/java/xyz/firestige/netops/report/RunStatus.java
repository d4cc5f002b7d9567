package xyz.firestige.netops.report;

/**
 * 运行总体状态
 */
public enum RunStatus {

    /**
     * 没有任何 Failed 结果
     */
    SUCCESS,

    /**
     * 至少一个 (阶段, 设备) 失败
     */
    PARTIAL_FAILURE,

    /**
     * 预检校验失败，没有触碰任何设备
     */
    ABORTED
}
