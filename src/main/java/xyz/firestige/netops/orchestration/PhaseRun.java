package xyz.firestige.netops.orchestration;

import java.time.LocalDateTime;

import xyz.firestige.netops.exception.FailureInfo;
import xyz.firestige.netops.execution.PhaseResult;

/**
 * 一个阶段在本次运行中的状态：PENDING → RUNNING → COMPLETED，只能前进
 * <p>
 * startSequence / completeSequence 取自运行内单调递增的序号，
 * 用来比较不同阶段开始与完成的先后（墙钟时间可能相等）。
 */
public class PhaseRun {

    private final String name;
    private volatile PhaseState state = PhaseState.PENDING;
    private volatile LocalDateTime startedAt;
    private volatile LocalDateTime completedAt;
    private volatile long startSequence = -1;
    private volatile long completeSequence = -1;
    private volatile PhaseResult result;
    private volatile FailureInfo crash;

    public PhaseRun(String name) {
        this.name = name;
    }

    synchronized void markRunning(long sequence) {
        if (state != PhaseState.PENDING) {
            throw new IllegalStateException("阶段不能重复进入: " + name + ", state: " + state);
        }
        this.startSequence = sequence;
        this.startedAt = LocalDateTime.now();
        this.state = PhaseState.RUNNING;
    }

    synchronized void markCompleted(long sequence, PhaseResult result, FailureInfo crash) {
        if (state != PhaseState.RUNNING) {
            throw new IllegalStateException("阶段未在运行: " + name + ", state: " + state);
        }
        this.result = result;
        this.crash = crash;
        this.completeSequence = sequence;
        this.completedAt = LocalDateTime.now();
        this.state = PhaseState.COMPLETED;
    }

    /**
     * 未真正执行设备动作就结束（运行已取消或前驱崩溃），所有设备记为 Skipped
     */
    synchronized void markSkipped(long startSequence, long completeSequence, PhaseResult result) {
        markRunning(startSequence);
        markCompleted(completeSequence, result, null);
    }

    public String getName() {
        return name;
    }

    public PhaseState getState() {
        return state;
    }

    public LocalDateTime getStartedAt() {
        return startedAt;
    }

    public LocalDateTime getCompletedAt() {
        return completedAt;
    }

    public long getStartSequence() {
        return startSequence;
    }

    public long getCompleteSequence() {
        return completeSequence;
    }

    public PhaseResult getResult() {
        return result;
    }

    /**
     * 执行器自身崩溃时的失败信息；设备级失败不算崩溃
     */
    public FailureInfo getCrash() {
        return crash;
    }

    public boolean isCrashed() {
        return crash != null;
    }

    @Override
    public String toString() {
        return "PhaseRun{" + name + ", " + state + (crash != null ? ", crashed" : "") + "}";
    }
}
