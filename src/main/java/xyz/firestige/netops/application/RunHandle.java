package xyz.firestige.netops.application;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import xyz.firestige.netops.execution.RunContext;
import xyz.firestige.netops.report.RunReport;

/**
 * 异步运行的句柄：取消与等待报告
 * <p>
 * 取消只阻止尚未开始的设备动作，在途动作照常完成并记录。
 */
public class RunHandle {

    private final RunContext context;
    private final CompletableFuture<RunReport> future;

    RunHandle(RunContext context, CompletableFuture<RunReport> future) {
        this.context = context;
        this.future = future;
    }

    public String getRunId() {
        return context.getRunId();
    }

    public void cancel() {
        context.requestCancel();
    }

    public boolean isCancelRequested() {
        return context.isCancelRequested();
    }

    public boolean isDone() {
        return future.isDone();
    }

    /**
     * 阻塞直到报告产出
     */
    public RunReport await() {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }
}
