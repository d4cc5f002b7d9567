package xyz.firestige.netops.orchestration;

public enum PhaseState {
    PENDING,
    RUNNING,
    COMPLETED
}
