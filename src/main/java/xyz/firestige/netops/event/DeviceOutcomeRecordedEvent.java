package xyz.firestige.netops.event;

import xyz.firestige.netops.domain.outcome.DeviceOutcome;

public class DeviceOutcomeRecordedEvent extends RunEvent {

    private final DeviceOutcome outcome;

    public DeviceOutcomeRecordedEvent(String runId, DeviceOutcome outcome) {
        super(runId);
        this.outcome = outcome;
    }

    public DeviceOutcome getOutcome() {
        return outcome;
    }
}
