package xyz.firestige.netops.exception;

/**
 * 请求恢复的快照不存在
 */
public class SnapshotNotFoundException extends NetOpsException {

    public SnapshotNotFoundException(String deviceName, String snapshotId) {
        super(ErrorType.SYSTEM_ERROR, "快照不存在: device=" + deviceName + ", snapshotId=" + snapshotId);
        addContext("device", deviceName);
        addContext("snapshotId", snapshotId);
    }
}
