package xyz.firestige.netops.event;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * 运行期事件基类
 */
public abstract class RunEvent {

    private final String eventId;
    private final String runId;
    private final LocalDateTime timestamp;

    protected RunEvent(String runId) {
        this.eventId = UUID.randomUUID().toString();
        this.runId = runId;
        this.timestamp = LocalDateTime.now();
    }

    public String getEventName() {
        return this.getClass().getSimpleName();
    }

    public String getEventId() {
        return eventId;
    }

    public String getRunId() {
        return runId;
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }
}
