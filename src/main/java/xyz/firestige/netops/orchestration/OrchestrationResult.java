package xyz.firestige.netops.orchestration;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import xyz.firestige.netops.domain.outcome.DeviceOutcome;
import xyz.firestige.netops.execution.PhaseResult;

/**
 * 一次编排的全部阶段状态，按拓扑序排列
 */
public class OrchestrationResult {

    private final String runId;
    private final Map<String, PhaseRun> phaseRuns;
    private final LocalDateTime startedAt;
    private final LocalDateTime completedAt;

    public OrchestrationResult(String runId, Map<String, PhaseRun> phaseRuns, LocalDateTime startedAt, LocalDateTime completedAt) {
        this.runId = runId;
        this.phaseRuns = Collections.unmodifiableMap(new LinkedHashMap<>(phaseRuns));
        this.startedAt = startedAt;
        this.completedAt = completedAt;
    }

    public String getRunId() {
        return runId;
    }

    public Map<String, PhaseRun> getPhaseRuns() {
        return phaseRuns;
    }

    public PhaseRun phase(String name) {
        return phaseRuns.get(name);
    }

    public List<PhaseResult> getPhaseResults() {
        List<PhaseResult> results = new ArrayList<>();
        for (PhaseRun run : phaseRuns.values()) {
            if (run.getResult() != null) {
                results.add(run.getResult());
            }
        }
        return results;
    }

    public List<DeviceOutcome> allOutcomes() {
        List<DeviceOutcome> outcomes = new ArrayList<>();
        for (PhaseResult result : getPhaseResults()) {
            outcomes.addAll(result.getOutcomes().values());
        }
        return outcomes;
    }

    public boolean isAllCompleted() {
        return phaseRuns.values().stream().allMatch(r -> r.getState() == PhaseState.COMPLETED);
    }

    public LocalDateTime getStartedAt() {
        return startedAt;
    }

    public LocalDateTime getCompletedAt() {
        return completedAt;
    }
}
