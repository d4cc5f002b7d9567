package xyz.firestige.netops.report;

public record RunSummary(int total, int succeeded, int failed, int skipped) {
}
