package xyz.firestige.netops.execution;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import xyz.firestige.netops.domain.outcome.DeviceOutcome;
import xyz.firestige.netops.domain.outcome.OutcomeStatus;

/**
 * 一个阶段的执行结果：设备名 → DeviceOutcome
 * <p>
 * 只有在所有设备都进入终态之后才会构造。
 */
public class PhaseResult {

    private final String phase;
    private final Map<String, DeviceOutcome> outcomes;
    private final LocalDateTime startedAt;
    private final LocalDateTime completedAt;

    public PhaseResult(String phase, Map<String, DeviceOutcome> outcomes, LocalDateTime startedAt, LocalDateTime completedAt) {
        this.phase = phase;
        this.outcomes = Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
        this.startedAt = startedAt;
        this.completedAt = completedAt;
    }

    public static PhaseResult empty(String phase) {
        LocalDateTime now = LocalDateTime.now();
        return new PhaseResult(phase, Map.of(), now, now);
    }

    public String getPhase() {
        return phase;
    }

    public Map<String, DeviceOutcome> getOutcomes() {
        return outcomes;
    }

    public DeviceOutcome outcomeOf(String deviceName) {
        return outcomes.get(deviceName);
    }

    public long count(OutcomeStatus status) {
        return outcomes.values().stream().filter(o -> o.getStatus() == status).count();
    }

    public boolean hasFailures() {
        return count(OutcomeStatus.FAILED) > 0;
    }

    public List<DeviceOutcome> failures() {
        return outcomes.values().stream().filter(DeviceOutcome::isFailed).collect(Collectors.toList());
    }

    public LocalDateTime getStartedAt() {
        return startedAt;
    }

    public LocalDateTime getCompletedAt() {
        return completedAt;
    }

    @Override
    public String toString() {
        return String.format("PhaseResult[%s succeeded=%d failed=%d skipped=%d]", phase,
                count(OutcomeStatus.SUCCEEDED), count(OutcomeStatus.FAILED), count(OutcomeStatus.SKIPPED));
    }
}
