package xyz.firestige.netops.report;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import xyz.firestige.netops.domain.outcome.DeviceOutcome;
import xyz.firestige.netops.execution.PhaseResult;
import xyz.firestige.netops.orchestration.OrchestrationResult;
import xyz.firestige.netops.orchestration.PhaseRun;
import xyz.firestige.netops.validation.ValidationError;

/**
 * 报告组装：从不抛出异常，即使所有设备都失败也能产出报告
 */
public class RunReportAssembler {

    private static final Logger log = LoggerFactory.getLogger(RunReportAssembler.class);

    public RunReport assemble(OrchestrationResult result) {
        List<ReportEntry> entries = new ArrayList<>();
        List<String> crashed = new ArrayList<>();
        boolean anyFailed = false;
        try {
            for (PhaseRun run : result.getPhaseRuns().values()) {
                if (run.isCrashed()) {
                    crashed.add(run.getName());
                    anyFailed = true;
                }
                PhaseResult phaseResult = run.getResult();
                if (phaseResult == null) {
                    continue;
                }
                for (DeviceOutcome outcome : phaseResult.getOutcomes().values()) {
                    entries.add(ReportEntry.from(outcome));
                    anyFailed |= outcome.isFailed();
                }
            }
        } catch (RuntimeException e) {
            // 组装本身出错也要给出报告，已收集的条目保留
            log.error("组装运行报告时出错, runId: {}", result.getRunId(), e);
            anyFailed = true;
        }
        RunStatus status = anyFailed ? RunStatus.PARTIAL_FAILURE : RunStatus.SUCCESS;
        RunReport report = new RunReport(result.getRunId(), status, result.getStartedAt(),
                result.getCompletedAt() != null ? result.getCompletedAt() : LocalDateTime.now(),
                entries, List.of(), crashed);
        log.info("运行报告: {}", report);
        return report;
    }

    /**
     * 校验失败：没有任何设备被触碰
     */
    public RunReport aborted(String runId, LocalDateTime startedAt, List<ValidationError> violations) {
        RunReport report = new RunReport(runId, RunStatus.ABORTED, startedAt, LocalDateTime.now(),
                List.of(), violations, List.of());
        log.info("运行报告: {}", report);
        return report;
    }
}
