package xyz.firestige.netops.execution;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import xyz.firestige.netops.domain.device.Device;
import xyz.firestige.netops.domain.intent.Directive;
import xyz.firestige.netops.domain.outcome.DeviceOutcome;
import xyz.firestige.netops.domain.outcome.SkipCause;
import xyz.firestige.netops.exception.DeviceTimeoutException;
import xyz.firestige.netops.exception.ErrorType;
import xyz.firestige.netops.exception.FailureInfo;
import xyz.firestige.netops.execution.retry.RetryStrategy;
import xyz.firestige.netops.metrics.MetricNames;

/**
 * 单台设备的动作执行器：取消检查、超时、有界重试、异常转结果
 * <p>
 * 只对连接类错误（含超时）重试，命令被拒绝等其他错误立即记为失败。
 * 本类从不向外抛出异常，所有结果都以 {@link DeviceOutcome} 返回。
 * <p>
 * 超时的尝试会被放弃并中断，但阻塞 I/O 未必响应中断：放弃后最多再等一个超时周期，
 * 原尝试结束才允许重试；等不到就直接记为超时失败。同一设备任何时刻最多一个尝试在跑。
 */
public class DeviceActionRunner {

    private static final Logger log = LoggerFactory.getLogger(DeviceActionRunner.class);

    private final RetryStrategy retryStrategy;
    private final Duration actionTimeout;
    private final ExecutorService attemptExecutor;

    /**
     * @param actionTimeout   单次尝试的上限，null 表示不限时（在调用线程上直接执行）
     * @param attemptExecutor 限时执行单次尝试的线程池
     */
    public DeviceActionRunner(RetryStrategy retryStrategy, Duration actionTimeout, ExecutorService attemptExecutor) {
        this.retryStrategy = retryStrategy != null ? retryStrategy : RetryStrategy.none();
        this.actionTimeout = actionTimeout;
        this.attemptExecutor = attemptExecutor;
        if (actionTimeout != null && attemptExecutor == null) {
            throw new IllegalArgumentException("限时执行需要 attemptExecutor");
        }
    }

    public DeviceOutcome run(String phase, Device device, List<Directive> directives, DeviceAction action, RunContext ctx) {
        String deviceName = device.getName();
        if (ctx.isCancelRequested()) {
            log.info("运行已取消，跳过设备动作, phase: {}, device: {}", phase, deviceName);
            return DeviceOutcome.skipped(phase, deviceName, SkipCause.CANCELLED);
        }

        long startNanos = System.nanoTime();
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                String detail = invoke(phase, device, directives, action, ctx);
                return DeviceOutcome.succeeded(phase, deviceName, attempt, elapsed(startNanos), detail);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return interrupted(phase, deviceName, attempt, startNanos);
            } catch (Throwable t) {
                // 隔离边界：任何异常（包括 Error）只终结本设备的动作
                if (retryStrategy.isRetryable(t) && !attemptStillRunning(t)) {
                    Duration delay = retryStrategy.nextDelay(attempt, t);
                    if (delay != null) {
                        log.warn("连接类失败，{}ms 后重试, phase: {}, device: {}, attempt: {}, error: {}",
                                delay.toMillis(), phase, deviceName, attempt, t.getMessage());
                        ctx.getMetrics().incrementCounter(MetricNames.DEVICE_RETRY);
                        if (!sleep(delay)) {
                            return interrupted(phase, deviceName, attempt, startNanos);
                        }
                        continue;
                    }
                }
                FailureInfo failure = FailureInfo.fromException(t, phase);
                log.error("设备动作失败, phase: {}, device: {}, attempts: {}, type: {}, error: {}",
                        phase, deviceName, attempt, failure.getErrorType(), failure.getErrorMessage());
                return DeviceOutcome.failed(phase, deviceName, failure, attempt, elapsed(startNanos));
            }
        }
    }

    private String invoke(String phase, Device device, List<Directive> directives, DeviceAction action, RunContext ctx)
            throws Exception {
        if (actionTimeout == null) {
            return action.apply(device, directives, ctx);
        }
        RunContext attemptCtx = ctx.forAttempt();
        CountDownLatch finished = new CountDownLatch(1);
        Future<String> future = attemptExecutor.submit(() -> {
            attemptCtx.injectMdc(phase, device.getName());
            try {
                return action.apply(device, directives, attemptCtx);
            } finally {
                attemptCtx.clearMdc();
                finished.countDown();
            }
        });
        try {
            return future.get(actionTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            if (!attemptCtx.abandonAttempt()) {
                // 已进入提交，结果以提交为准
                log.info("尝试超时但已在提交结果，等待提交完成, phase: {}, device: {}", phase, device.getName());
                return unwrap(future);
            }
            future.cancel(true);
            boolean ended = finished.await(actionTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!ended) {
                log.warn("超时尝试不响应中断，放弃重试, phase: {}, device: {}", phase, device.getName());
            }
            throw new DeviceTimeoutException(device.getName(), actionTimeout, !ended);
        } catch (InterruptedException e) {
            attemptCtx.abandonAttempt();
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            throw rethrow(e);
        }
    }

    private String unwrap(Future<String> future) throws Exception {
        try {
            return future.get();
        } catch (ExecutionException e) {
            throw rethrow(e);
        }
    }

    private Exception rethrow(ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof Exception) {
            return (Exception) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        return e;
    }

    private boolean attemptStillRunning(Throwable t) {
        return t instanceof DeviceTimeoutException && ((DeviceTimeoutException) t).isAttemptStillRunning();
    }

    private DeviceOutcome interrupted(String phase, String deviceName, int attempt, long startNanos) {
        log.warn("设备动作被中断, phase: {}, device: {}", phase, deviceName);
        FailureInfo failure = FailureInfo.of(ErrorType.SYSTEM_ERROR, "设备动作被中断", phase);
        return DeviceOutcome.failed(phase, deviceName, failure, attempt, elapsed(startNanos));
    }

    private boolean sleep(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
