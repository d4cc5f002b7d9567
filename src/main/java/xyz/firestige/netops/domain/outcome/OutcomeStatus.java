package xyz.firestige.netops.domain.outcome;

/**
 * 设备在某阶段的终态
 */
public enum OutcomeStatus {
    SUCCEEDED,
    FAILED,
    SKIPPED
}
