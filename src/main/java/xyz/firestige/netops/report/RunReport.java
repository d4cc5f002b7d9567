package xyz.firestige.netops.report;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import xyz.firestige.netops.domain.outcome.OutcomeStatus;
import xyz.firestige.netops.validation.ValidationError;

/**
 * 运行报告
 *
 * <p>外部（通知、CI）判断成败的唯一依据。条目按阶段拓扑序、阶段内按清单顺序排列，
 * 每个 (阶段, 设备) 一条。
 */
public class RunReport {

    private final String runId;
    private final RunStatus status;
    private final LocalDateTime startedAt;
    private final LocalDateTime finishedAt;
    private final List<ReportEntry> entries;
    private final List<ValidationError> violations;
    private final List<String> crashedPhases;

    public RunReport(String runId, RunStatus status, LocalDateTime startedAt, LocalDateTime finishedAt,
                     List<ReportEntry> entries, List<ValidationError> violations, List<String> crashedPhases) {
        this.runId = runId;
        this.status = status;
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
        this.entries = List.copyOf(entries);
        this.violations = List.copyOf(violations);
        this.crashedPhases = List.copyOf(crashedPhases);
    }

    public Optional<ReportEntry> entry(String phase, String device) {
        return entries.stream()
                .filter(e -> e.getPhase().equals(phase) && e.getDevice().equals(device))
                .findFirst();
    }

    public List<ReportEntry> entriesOf(String phase) {
        return entries.stream().filter(e -> e.getPhase().equals(phase)).collect(Collectors.toList());
    }

    /**
     * 所有失败的 (阶段, 设备) 及原因
     */
    public List<ReportEntry> getFailures() {
        return entries.stream().filter(e -> e.getStatus() == OutcomeStatus.FAILED).collect(Collectors.toList());
    }

    public RunSummary getSummary() {
        int succeeded = 0;
        int failed = 0;
        int skipped = 0;
        for (ReportEntry entry : entries) {
            switch (entry.getStatus()) {
                case SUCCEEDED:
                    succeeded++;
                    break;
                case FAILED:
                    failed++;
                    break;
                default:
                    skipped++;
                    break;
            }
        }
        return new RunSummary(entries.size(), succeeded, failed, skipped);
    }

    public boolean isSuccess() {
        return status == RunStatus.SUCCESS;
    }

    public String getRunId() {
        return runId;
    }

    public RunStatus getStatus() {
        return status;
    }

    public LocalDateTime getStartedAt() {
        return startedAt;
    }

    public LocalDateTime getFinishedAt() {
        return finishedAt;
    }

    public List<ReportEntry> getEntries() {
        return entries;
    }

    public List<ValidationError> getViolations() {
        return violations;
    }

    public List<String> getCrashedPhases() {
        return crashedPhases;
    }

    @Override
    public String toString() {
        RunSummary summary = getSummary();
        return "RunReport{runId=" + runId + ", status=" + status
                + ", succeeded=" + summary.succeeded() + ", failed=" + summary.failed()
                + ", skipped=" + summary.skipped() + ", violations=" + violations.size() + "}";
    }
}
