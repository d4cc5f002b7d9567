package xyz.firestige.netops.execution;

import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import xyz.firestige.netops.event.DomainEventPublisher;
import xyz.firestige.netops.metrics.MetricsRegistry;
import xyz.firestige.netops.metrics.NoopMetricsRegistry;

/**
 * 单次运行的上下文：运行 id、取消信号、MDC 与运行期协作者
 * <p>
 * 每次运行新建一个，显式传给 PhaseExecutor 与 BackupStore，不做进程级单例。
 * <p>
 * 限时执行的设备动作拿到的是 {@link #forAttempt()} 派生出的单次尝试视图：与运行共享取消信号，
 * 另带一个尝试状态。超时放弃与持久化提交在该状态上二选一，被放弃的尝试不能再提交任何结果。
 */
public class RunContext {

    private static final Logger log = LoggerFactory.getLogger(RunContext.class);

    public static final String MDC_RUN_ID = "runId";
    public static final String MDC_PHASE = "phase";
    public static final String MDC_DEVICE = "device";

    private final String runId;
    private final MetricsRegistry metrics;
    private final DomainEventPublisher eventPublisher;
    private final AtomicBoolean cancelRequested;

    /**
     * 单次尝试状态，运行级上下文为 null
     */
    private final AtomicReference<AttemptState> attemptState;

    public RunContext(String runId, MetricsRegistry metrics, DomainEventPublisher eventPublisher) {
        this(Objects.requireNonNull(runId, "runId"),
                metrics != null ? metrics : new NoopMetricsRegistry(),
                eventPublisher != null ? eventPublisher : DomainEventPublisher.noop(),
                new AtomicBoolean(false), null);
    }

    private RunContext(String runId, MetricsRegistry metrics, DomainEventPublisher eventPublisher,
                       AtomicBoolean cancelRequested, AtomicReference<AttemptState> attemptState) {
        this.runId = runId;
        this.metrics = metrics;
        this.eventPublisher = eventPublisher;
        this.cancelRequested = cancelRequested;
        this.attemptState = attemptState;
    }

    public static RunContext create(MetricsRegistry metrics, DomainEventPublisher eventPublisher) {
        return new RunContext(newRunId(), metrics, eventPublisher);
    }

    /**
     * 无指标、无事件的上下文，测试与离线工具使用
     */
    public static RunContext standalone() {
        return new RunContext(newRunId(), null, null);
    }

    private static String newRunId() {
        return "run-" + UUID.randomUUID().toString().substring(0, 8);
    }

    public void injectMdc(String phase, String deviceName) {
        MDC.put(MDC_RUN_ID, runId);
        if (phase != null) {
            MDC.put(MDC_PHASE, phase);
        }
        if (deviceName != null) {
            MDC.put(MDC_DEVICE, deviceName);
        }
    }

    public void clearMdc() {
        MDC.remove(MDC_RUN_ID);
        MDC.remove(MDC_PHASE);
        MDC.remove(MDC_DEVICE);
    }

    /**
     * 发出取消信号：尚未开始的设备动作与阶段不再执行，进行中的动作照常完成
     */
    public void requestCancel() {
        this.cancelRequested.set(true);
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    /**
     * 派生一次尝试的上下文
     */
    RunContext forAttempt() {
        return new RunContext(runId, metrics, eventPublisher, cancelRequested,
                new AtomicReference<>(AttemptState.RUNNING));
    }

    /**
     * 持久化前调用：尝试仍在进行则转入提交状态并返回 true；已被放弃返回 false，调用方不得提交。
     * 运行级上下文总是返回 true。
     */
    public boolean beginCommit() {
        return attemptState == null
                || attemptState.compareAndSet(AttemptState.RUNNING, AttemptState.COMMITTING)
                || attemptState.get() == AttemptState.COMMITTING;
    }

    /**
     * 超时后放弃本次尝试；若尝试已进入提交返回 false，调用方应等待其完成并采用其结果
     */
    boolean abandonAttempt() {
        return attemptState != null && attemptState.compareAndSet(AttemptState.RUNNING, AttemptState.ABANDONED);
    }

    public boolean isAttemptAbandoned() {
        return attemptState != null && attemptState.get() == AttemptState.ABANDONED;
    }

    private enum AttemptState {
        RUNNING, COMMITTING, ABANDONED
    }

    /**
     * 发布事件；发布失败只记录，不影响设备结果
     */
    public void publish(Object event) {
        try {
            eventPublisher.publish(event);
        } catch (RuntimeException e) {
            log.warn("事件发布失败, runId: {}, event: {}", runId, event.getClass().getSimpleName(), e);
        }
    }

    public String getRunId() {
        return runId;
    }

    public MetricsRegistry getMetrics() {
        return metrics;
    }
}
