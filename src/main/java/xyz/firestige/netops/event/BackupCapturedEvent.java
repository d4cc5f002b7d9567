package xyz.firestige.netops.event;

/**
 * 新快照已追加且 latest 指针已切换
 */
public class BackupCapturedEvent extends RunEvent {

    private final String deviceName;
    private final String snapshotId;
    private final String contentHash;

    public BackupCapturedEvent(String runId, String deviceName, String snapshotId, String contentHash) {
        super(runId);
        this.deviceName = deviceName;
        this.snapshotId = snapshotId;
        this.contentHash = contentHash;
    }

    public String getDeviceName() {
        return deviceName;
    }

    public String getSnapshotId() {
        return snapshotId;
    }

    public String getContentHash() {
        return contentHash;
    }
}
