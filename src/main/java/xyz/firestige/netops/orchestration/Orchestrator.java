package xyz.firestige.netops.orchestration;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import xyz.firestige.netops.domain.device.Device;
import xyz.firestige.netops.domain.device.Inventory;
import xyz.firestige.netops.domain.intent.Directive;
import xyz.firestige.netops.domain.intent.IntentSet;
import xyz.firestige.netops.domain.outcome.DeviceOutcome;
import xyz.firestige.netops.domain.outcome.OutcomeStatus;
import xyz.firestige.netops.domain.outcome.SkipCause;
import xyz.firestige.netops.event.PhaseCompletedEvent;
import xyz.firestige.netops.event.PhaseStartedEvent;
import xyz.firestige.netops.exception.ErrorType;
import xyz.firestige.netops.exception.FailureInfo;
import xyz.firestige.netops.execution.PhaseExecutor;
import xyz.firestige.netops.execution.PhaseResult;
import xyz.firestige.netops.execution.RunContext;
import xyz.firestige.netops.metrics.MetricNames;

/**
 * 编排器：按阶段依赖图推进一次运行
 *
 * <p>调度规则：
 * <ul>
 *   <li>阶段的全部前驱 COMPLETED 后才进入 RUNNING（前驱里设备成功与否不影响）</li>
 *   <li>同时就绪、彼此无依赖的阶段并行执行</li>
 *   <li>每个阶段在一次运行中只执行一次</li>
 *   <li>运行已取消时，尚未开始的阶段所有设备记为 Skipped(cancelled)</li>
 *   <li>执行器自身崩溃的阶段，其下游阶段所有设备记为 Skipped(predecessor-crashed)</li>
 * </ul>
 * 无论如何，{@link #run} 都会在所有阶段 COMPLETED 后返回。
 */
public class Orchestrator {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    private final PhaseExecutor phaseExecutor;

    public Orchestrator(PhaseExecutor phaseExecutor) {
        this.phaseExecutor = phaseExecutor;
    }

    public OrchestrationResult run(PhaseGraph graph, Inventory inventory, IntentSet intents, RunContext ctx) {
        return new Execution(graph, inventory, intents, ctx).run();
    }

    /**
     * 单次运行的调度状态，只由调用 run 的协调线程推进
     */
    private class Execution {

        private final PhaseGraph graph;
        private final Inventory inventory;
        private final IntentSet intents;
        private final RunContext ctx;
        private final Map<String, PhaseRun> runs = new LinkedHashMap<>();
        private final AtomicLong sequence = new AtomicLong();
        private final AtomicInteger running = new AtomicInteger();
        private final Set<String> blocked = new HashSet<>();
        private int completed;
        private int inFlight;

        Execution(PhaseGraph graph, Inventory inventory, IntentSet intents, RunContext ctx) {
            this.graph = graph;
            this.inventory = inventory;
            this.intents = intents;
            this.ctx = ctx;
            for (String name : graph.topologicalOrder()) {
                runs.put(name, new PhaseRun(name));
            }
        }

        OrchestrationResult run() {
            LocalDateTime startedAt = LocalDateTime.now();
            log.info("开始编排, runId: {}, phases: {}", ctx.getRunId(), graph.topologicalOrder());
            ExecutorService phasePool = Executors.newCachedThreadPool(r -> {
                Thread t = new Thread(r, "netops-phase-" + ctx.getRunId());
                t.setDaemon(true);
                return t;
            });
            CompletionService<String> completion = new ExecutorCompletionService<>(phasePool);
            boolean interrupted = false;
            try {
                while (completed < runs.size()) {
                    startReadyPhases(completion);
                    if (completed == runs.size()) {
                        break;
                    }
                    if (inFlight == 0) {
                        throw new IllegalStateException("没有可推进的阶段，阶段图状态异常: " + runs.values());
                    }
                    try {
                        String finished = completion.take().get();
                        inFlight--;
                        completed++;
                        log.debug("阶段结束: {}", finished);
                    } catch (InterruptedException e) {
                        // 协调线程被中断视为取消：在途阶段照常收尾，未开始的阶段全部跳过
                        interrupted = true;
                        ctx.requestCancel();
                        log.warn("编排线程被中断，转为取消运行, runId: {}", ctx.getRunId());
                    } catch (ExecutionException e) {
                        throw new IllegalStateException("阶段任务异常结束", e.getCause());
                    }
                }
            } finally {
                phasePool.shutdown();
                if (interrupted) {
                    Thread.currentThread().interrupt();
                }
            }
            log.info("编排结束, runId: {}", ctx.getRunId());
            return new OrchestrationResult(ctx.getRunId(), runs, startedAt, LocalDateTime.now());
        }

        private void startReadyPhases(CompletionService<String> completion) {
            boolean changed = true;
            while (changed) {
                changed = false;
                for (PhaseRun run : runs.values()) {
                    if (run.getState() == PhaseState.PENDING && predecessorsCompleted(run.getName())) {
                        start(run, completion);
                        changed = true;
                    }
                }
            }
        }

        private boolean predecessorsCompleted(String name) {
            for (String dep : graph.get(name).getDependsOn()) {
                if (runs.get(dep).getState() != PhaseState.COMPLETED) {
                    return false;
                }
            }
            return true;
        }

        private void start(PhaseRun run, CompletionService<String> completion) {
            PhaseDefinition def = graph.get(run.getName());
            List<Device> devices = def.getDeviceNames() == null ? inventory.devices() : inventory.subset(def.getDeviceNames());

            String crashedPredecessor = crashedPredecessorOf(def);
            if (crashedPredecessor != null) {
                log.warn("前驱阶段 {} 崩溃，跳过阶段 {}", crashedPredecessor, def.getName());
                blocked.add(def.getName());
                completeSkipped(run, devices, SkipCause.PREDECESSOR_CRASHED);
                return;
            }
            if (ctx.isCancelRequested()) {
                log.info("运行已取消，跳过阶段 {}", def.getName());
                completeSkipped(run, devices, SkipCause.CANCELLED);
                return;
            }

            run.markRunning(sequence.incrementAndGet());
            ctx.getMetrics().setGauge(MetricNames.PHASE_RUNNING, running.incrementAndGet());
            ctx.publish(new PhaseStartedEvent(ctx.getRunId(), def.getName(), devices.size()));
            inFlight++;
            completion.submit(() -> {
                executePhase(run, def, devices);
                return def.getName();
            });
        }

        private void executePhase(PhaseRun run, PhaseDefinition def, List<Device> devices) {
            ctx.injectMdc(def.getName(), null);
            PhaseResult result;
            FailureInfo crash = null;
            try {
                result = phaseExecutor.execute(def.getName(), devices,
                        device -> def.getStage() == null ? List.<Directive>of() : intents.sliceFor(device.getName(), def.getStage()),
                        def.getAction(), def.getConcurrency(), ctx);
            } catch (Throwable t) {
                // 阶段执行器崩溃：本阶段所有设备记为失败，下游阶段据此跳过
                log.error("阶段执行器崩溃, phase: {}", def.getName(), t);
                crash = FailureInfo.fromException(t, def.getName());
                result = crashedResult(def.getName(), devices, crash);
            } finally {
                ctx.clearMdc();
            }
            run.markCompleted(sequence.incrementAndGet(), result, crash);
            ctx.getMetrics().setGauge(MetricNames.PHASE_RUNNING, running.decrementAndGet());
            publishCompleted(result);
        }

        private void completeSkipped(PhaseRun run, List<Device> devices, SkipCause cause) {
            Map<String, DeviceOutcome> outcomes = new LinkedHashMap<>();
            for (Device device : devices) {
                outcomes.put(device.getName(), DeviceOutcome.skipped(run.getName(), device.getName(), cause));
                ctx.getMetrics().incrementCounter(MetricNames.DEVICE_SKIPPED);
            }
            LocalDateTime now = LocalDateTime.now();
            PhaseResult result = new PhaseResult(run.getName(), outcomes, now, now);
            long startSeq = sequence.incrementAndGet();
            run.markSkipped(startSeq, sequence.incrementAndGet(), result);
            completed++;
            publishCompleted(result);
        }

        private PhaseResult crashedResult(String phase, List<Device> devices, FailureInfo crash) {
            Map<String, DeviceOutcome> outcomes = new LinkedHashMap<>();
            FailureInfo failure = FailureInfo.of(ErrorType.SYSTEM_ERROR, "阶段执行器异常: " + crash.getErrorMessage(), phase);
            for (Device device : devices) {
                outcomes.put(device.getName(), DeviceOutcome.failed(phase, device.getName(), failure, 0, Duration.ZERO));
            }
            LocalDateTime now = LocalDateTime.now();
            return new PhaseResult(phase, outcomes, now, now);
        }

        private String crashedPredecessorOf(PhaseDefinition def) {
            for (String dep : def.getDependsOn()) {
                if (runs.get(dep).isCrashed() || blocked.contains(dep)) {
                    return dep;
                }
            }
            return null;
        }

        private void publishCompleted(PhaseResult result) {
            ctx.publish(new PhaseCompletedEvent(ctx.getRunId(), result.getPhase(),
                    result.count(OutcomeStatus.SUCCEEDED),
                    result.count(OutcomeStatus.FAILED),
                    result.count(OutcomeStatus.SKIPPED)));
        }
    }
}
