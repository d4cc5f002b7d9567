package xyz.firestige.netops.execution;

import xyz.firestige.netops.exception.ErrorType;
import xyz.firestige.netops.exception.NetOpsException;

/**
 * 阶段执行器自身崩溃（线程池拒绝、屏障等待被中断等），与设备级失败无关
 */
public class PhaseExecutionException extends NetOpsException {

    public PhaseExecutionException(String phase, String message, Throwable cause) {
        super(ErrorType.SYSTEM_ERROR, "阶段执行器异常: " + phase + ", " + message, cause);
        addContext("phase", phase);
    }
}
