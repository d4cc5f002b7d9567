package xyz.firestige.netops.execution;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import xyz.firestige.netops.domain.device.Device;
import xyz.firestige.netops.domain.intent.Directive;
import xyz.firestige.netops.domain.outcome.DeviceOutcome;
import xyz.firestige.netops.event.DeviceOutcomeRecordedEvent;
import xyz.firestige.netops.exception.FailureInfo;
import xyz.firestige.netops.execution.retry.RetryStrategy;
import xyz.firestige.netops.metrics.MetricNames;

/**
 * 阶段执行器
 *
 * <p>把一个阶段的设备动作并发地施加到一组设备上：
 * <ul>
 *   <li>每个阶段一个有界线程池，同时在途的设备动作不超过并发上限</li>
 *   <li>单台设备的异常在本边界转换为 Failed 结果，不影响其他设备</li>
 *   <li>所有设备进入终态后才返回（阶段屏障）</li>
 *   <li>设备集合为空时立即返回空结果</li>
 * </ul>
 *
 * <p>只有执行器自身的故障（线程池拒绝、屏障等待被中断）才会以
 * {@link PhaseExecutionException} 抛出。
 */
public class PhaseExecutor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PhaseExecutor.class);

    private final int defaultConcurrency;
    private final ExecutorService attemptExecutor;
    private final DeviceActionRunner runner;

    public PhaseExecutor(int defaultConcurrency, RetryStrategy retryStrategy, Duration actionTimeout) {
        if (defaultConcurrency <= 0) {
            throw new IllegalArgumentException("defaultConcurrency must be > 0");
        }
        this.defaultConcurrency = defaultConcurrency;
        this.attemptExecutor = actionTimeout != null ? Executors.newCachedThreadPool(daemonFactory("netops-attempt")) : null;
        this.runner = new DeviceActionRunner(retryStrategy, actionTimeout, attemptExecutor);
    }

    /**
     * 执行一个阶段
     *
     * @param phase       阶段名
     * @param devices     参与设备
     * @param slices      设备 → 本阶段指令切片
     * @param action      设备动作
     * @param concurrency 并发上限，&lt;= 0 时使用默认值
     * @param ctx         运行上下文
     */
    public PhaseResult execute(String phase, List<Device> devices, Function<Device, List<Directive>> slices,
                               DeviceAction action, int concurrency, RunContext ctx) {
        if (devices.isEmpty()) {
            log.info("阶段没有设备，直接完成, phase: {}", phase);
            return PhaseResult.empty(phase);
        }

        int bound = concurrency > 0 ? concurrency : defaultConcurrency;
        int workers = Math.min(bound, devices.size());
        LocalDateTime startedAt = LocalDateTime.now();
        log.info("开始执行阶段, phase: {}, devices: {}, workers: {}", phase, devices.size(), workers);

        ExecutorService pool = Executors.newFixedThreadPool(workers, daemonFactory("netops-" + phase));
        Map<String, Future<DeviceOutcome>> futures = new LinkedHashMap<>();
        try {
            for (Device device : devices) {
                futures.put(device.getName(), pool.submit(() -> runDevice(phase, device, slices, action, ctx)));
            }

            Map<String, DeviceOutcome> outcomes = new LinkedHashMap<>();
            for (Map.Entry<String, Future<DeviceOutcome>> entry : futures.entrySet()) {
                outcomes.put(entry.getKey(), await(phase, entry.getKey(), entry.getValue()));
            }

            PhaseResult result = new PhaseResult(phase, outcomes, startedAt, LocalDateTime.now());
            log.info("阶段执行完成: {}", result);
            return result;
        } catch (RejectedExecutionException e) {
            futures.values().forEach(f -> f.cancel(true));
            throw new PhaseExecutionException(phase, "线程池拒绝任务", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.values().forEach(f -> f.cancel(true));
            throw new PhaseExecutionException(phase, "等待阶段屏障时被中断", e);
        } finally {
            pool.shutdown();
        }
    }

    private DeviceOutcome runDevice(String phase, Device device, Function<Device, List<Directive>> slices,
                                    DeviceAction action, RunContext ctx) {
        ctx.injectMdc(phase, device.getName());
        try {
            DeviceOutcome outcome;
            try {
                outcome = runner.run(phase, device, slices.apply(device), action, ctx);
            } catch (RuntimeException e) {
                outcome = DeviceOutcome.failed(phase, device.getName(), FailureInfo.fromException(e, phase), 0, Duration.ZERO);
            }
            record(outcome, ctx);
            return outcome;
        } finally {
            ctx.clearMdc();
        }
    }

    private DeviceOutcome await(String phase, String deviceName, Future<DeviceOutcome> future) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            // runDevice 不抛异常；到这里说明是 Error 之类的崩溃，仍只记到该设备
            log.error("设备任务异常结束, phase: {}, device: {}", phase, deviceName, e.getCause());
            return DeviceOutcome.failed(phase, deviceName, FailureInfo.fromException(e.getCause(), phase), 0, Duration.ZERO);
        }
    }

    private void record(DeviceOutcome outcome, RunContext ctx) {
        switch (outcome.getStatus()) {
            case SUCCEEDED:
                ctx.getMetrics().incrementCounter(MetricNames.DEVICE_SUCCEEDED);
                log.info("设备动作成功, phase: {}, device: {}, attempts: {}, 耗时: {}ms",
                        outcome.getPhase(), outcome.getDeviceName(), outcome.getAttempts(), outcome.getDuration().toMillis());
                break;
            case FAILED:
                ctx.getMetrics().incrementCounter(MetricNames.DEVICE_FAILED);
                break;
            default:
                ctx.getMetrics().incrementCounter(MetricNames.DEVICE_SKIPPED);
                break;
        }
        ctx.publish(new DeviceOutcomeRecordedEvent(ctx.getRunId(), outcome));
    }

    public int getDefaultConcurrency() {
        return defaultConcurrency;
    }

    @Override
    public void close() {
        if (attemptExecutor != null) {
            attemptExecutor.shutdownNow();
        }
    }

    private static ThreadFactory daemonFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
