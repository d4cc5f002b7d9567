package xyz.firestige.netops.event;

import xyz.firestige.netops.report.RunReport;

public class RunCompletedEvent extends RunEvent {

    private final RunReport report;

    public RunCompletedEvent(RunReport report) {
        super(report.getRunId());
        this.report = report;
    }

    public RunReport getReport() {
        return report;
    }
}
