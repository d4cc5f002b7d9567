package xyz.firestige.netops.event;

public class PhaseStartedEvent extends RunEvent {

    private final String phase;
    private final int deviceCount;

    public PhaseStartedEvent(String runId, String phase, int deviceCount) {
        super(runId);
        this.phase = phase;
        this.deviceCount = deviceCount;
    }

    public String getPhase() {
        return phase;
    }

    public int getDeviceCount() {
        return deviceCount;
    }
}
