package xyz.firestige.netops.event;

public class PhaseCompletedEvent extends RunEvent {

    private final String phase;
    private final long succeeded;
    private final long failed;
    private final long skipped;

    public PhaseCompletedEvent(String runId, String phase, long succeeded, long failed, long skipped) {
        super(runId);
        this.phase = phase;
        this.succeeded = succeeded;
        this.failed = failed;
        this.skipped = skipped;
    }

    public String getPhase() {
        return phase;
    }

    public long getSucceeded() {
        return succeeded;
    }

    public long getFailed() {
        return failed;
    }

    public long getSkipped() {
        return skipped;
    }
}
