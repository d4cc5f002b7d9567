package xyz.firestige.netops.application;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import xyz.firestige.netops.backup.BackupStore;
import xyz.firestige.netops.domain.device.Inventory;
import xyz.firestige.netops.domain.intent.IntentSet;
import xyz.firestige.netops.driver.DeviceDriverRegistry;
import xyz.firestige.netops.event.DomainEventPublisher;
import xyz.firestige.netops.event.RunCompletedEvent;
import xyz.firestige.netops.execution.RunContext;
import xyz.firestige.netops.metrics.MetricsRegistry;
import xyz.firestige.netops.orchestration.OrchestrationResult;
import xyz.firestige.netops.orchestration.Orchestrator;
import xyz.firestige.netops.orchestration.PhaseGraph;
import xyz.firestige.netops.orchestration.StandardPhaseGraphs;
import xyz.firestige.netops.report.RunReport;
import xyz.firestige.netops.report.RunReportAssembler;
import xyz.firestige.netops.report.RunReportWriter;
import xyz.firestige.netops.session.DeviceSessionFactory;
import xyz.firestige.netops.validation.IntentValidationService;
import xyz.firestige.netops.validation.ValidationError;
import xyz.firestige.netops.validation.ValidationResult;

/**
 * 配置下发应用服务
 * <p>
 * 职责：
 * 1. 预检校验，失败时产出 ABORTED 报告且不触碰任何设备
 * 2. 按内置阶段图编排下发、备份
 * 3. 组装报告、发布 RunCompletedEvent、按需写出 JSON 报告
 * <p>
 * 每次运行都有独立的 {@link RunContext}，不存在跨运行共享的可变状态。
 */
public class ConfigurationRunService {

    private static final Logger logger = LoggerFactory.getLogger(ConfigurationRunService.class);

    private final IntentValidationService validationService;
    private final Orchestrator orchestrator;
    private final DeviceDriverRegistry driverRegistry;
    private final DeviceSessionFactory sessionFactory;
    private final BackupStore backupStore;
    private final RunReportAssembler reportAssembler;
    private final RunReportWriter reportWriter;
    private final Path reportDirectory;
    private final MetricsRegistry metrics;
    private final DomainEventPublisher eventPublisher;
    private final boolean connectivityCheck;
    private final ExecutorService runExecutor;

    public ConfigurationRunService(IntentValidationService validationService,
                                   Orchestrator orchestrator,
                                   DeviceDriverRegistry driverRegistry,
                                   DeviceSessionFactory sessionFactory,
                                   BackupStore backupStore,
                                   RunReportAssembler reportAssembler,
                                   RunReportWriter reportWriter,
                                   Path reportDirectory,
                                   MetricsRegistry metrics,
                                   DomainEventPublisher eventPublisher,
                                   boolean connectivityCheck) {
        this.validationService = validationService;
        this.orchestrator = orchestrator;
        this.driverRegistry = driverRegistry;
        this.sessionFactory = sessionFactory;
        this.backupStore = backupStore;
        this.reportAssembler = reportAssembler;
        this.reportWriter = reportWriter;
        this.reportDirectory = reportDirectory;
        this.metrics = metrics;
        this.eventPublisher = eventPublisher;
        this.connectivityCheck = connectivityCheck;
        AtomicInteger counter = new AtomicInteger();
        this.runExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "netops-run-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * 同步执行一次完整的配置下发
     */
    public RunReport run(Inventory inventory, IntentSet intents) {
        return execute(newContext(), inventory, intents);
    }

    /**
     * 异步执行，返回可取消的句柄
     */
    public RunHandle start(Inventory inventory, IntentSet intents) {
        RunContext ctx = newContext();
        CompletableFuture<RunReport> future = CompletableFuture.supplyAsync(() -> execute(ctx, inventory, intents), runExecutor);
        return new RunHandle(ctx, future);
    }

    /**
     * 把指定快照重新下发到设备
     *
     * @param snapshotIds 设备名 → 快照 id
     */
    public RunReport rollback(Inventory inventory, Map<String, String> snapshotIds) {
        RunContext ctx = newContext();
        ctx.injectMdc(null, null);
        try {
            LocalDateTime startedAt = LocalDateTime.now();
            logger.info("开始回滚, runId: {}, devices: {}", ctx.getRunId(), snapshotIds.keySet());
            List<ValidationError> violations = new ArrayList<>();
            for (Map.Entry<String, String> entry : snapshotIds.entrySet()) {
                if (!inventory.contains(entry.getKey())) {
                    violations.add(ValidationError.of(entry.getKey(), "device", "DEVICE_NOT_FOUND",
                            "回滚目标设备不在清单中", entry.getKey()));
                } else if (backupStore.history(entry.getKey()).stream().noneMatch(s -> s.getId().equals(entry.getValue()))) {
                    violations.add(ValidationError.of(entry.getKey(), "snapshotId", "SNAPSHOT_NOT_FOUND",
                            "快照不存在", entry.getValue()));
                }
            }
            RunReport report;
            if (!violations.isEmpty()) {
                report = reportAssembler.aborted(ctx.getRunId(), startedAt, violations);
            } else {
                PhaseGraph graph = StandardPhaseGraphs.rollbackRun(driverRegistry, sessionFactory, backupStore, snapshotIds);
                report = reportAssembler.assemble(orchestrator.run(graph, inventory, IntentSet.empty(), ctx));
            }
            return finish(report, ctx);
        } finally {
            ctx.clearMdc();
        }
    }

    private RunReport execute(RunContext ctx, Inventory inventory, IntentSet intents) {
        ctx.injectMdc(null, null);
        try {
            LocalDateTime startedAt = LocalDateTime.now();
            logger.info("开始配置下发, runId: {}, devices: {}, intents: {}", ctx.getRunId(), inventory.size(), intents.size());
            ValidationResult validation = validationService.validate(inventory, intents);
            if (!validation.isValid()) {
                logger.error("预检校验失败，运行中止, runId: {}, violations: {}", ctx.getRunId(), validation.getErrors().size());
                return finish(reportAssembler.aborted(ctx.getRunId(), startedAt, validation.getErrors()), ctx);
            }
            PhaseGraph graph = StandardPhaseGraphs.configurationRun(driverRegistry, sessionFactory, backupStore, connectivityCheck);
            OrchestrationResult result = orchestrator.run(graph, inventory, intents, ctx);
            return finish(reportAssembler.assemble(result), ctx);
        } finally {
            ctx.clearMdc();
        }
    }

    private RunReport finish(RunReport report, RunContext ctx) {
        ctx.publish(new RunCompletedEvent(report));
        if (reportWriter != null && reportDirectory != null) {
            try {
                Path written = reportWriter.write(report, reportDirectory);
                logger.info("运行报告已写出: {}", written);
            } catch (UncheckedIOException e) {
                // 报告对象已经产出，写文件失败只记录
                logger.error("写出运行报告失败, runId: {}", report.getRunId(), e);
            }
        }
        return report;
    }

    private RunContext newContext() {
        return RunContext.create(metrics, eventPublisher);
    }

    public void shutdown() {
        runExecutor.shutdown();
    }
}
