package xyz.firestige.netops.domain.backup;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HexFormat;
import java.util.Objects;

/**
 * 设备运行配置的一次快照（不可变）
 * <p>
 * id 由设备名与采集时间组成（{@code R1_20240101_120000_000}），
 * 外部工具可以把它当作不会被覆盖的制品名。
 */
public final class BackupSnapshot {

    public static final DateTimeFormatter ID_TIME_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");

    private final String id;
    private final String deviceName;
    private final LocalDateTime capturedAt;
    private final String content;
    private final String contentHash;

    private BackupSnapshot(String id, String deviceName, LocalDateTime capturedAt, String content, String contentHash) {
        this.id = id;
        this.deviceName = deviceName;
        this.capturedAt = capturedAt;
        this.content = content;
        this.contentHash = contentHash;
    }

    /**
     * 创建快照并计算内容哈希
     */
    public static BackupSnapshot create(String deviceName, LocalDateTime capturedAt, String content) {
        Objects.requireNonNull(deviceName, "deviceName");
        Objects.requireNonNull(capturedAt, "capturedAt");
        Objects.requireNonNull(content, "content");
        return new BackupSnapshot(idOf(deviceName, capturedAt), deviceName, capturedAt, content, sha256(content));
    }

    /**
     * 从持久化介质还原快照，哈希沿用存储的值，由调用方决定是否 {@link #verify()}
     */
    public static BackupSnapshot restore(String deviceName, LocalDateTime capturedAt, String content, String contentHash) {
        return new BackupSnapshot(idOf(deviceName, capturedAt), deviceName, capturedAt, content, contentHash);
    }

    public static String idOf(String deviceName, LocalDateTime capturedAt) {
        return deviceName + "_" + capturedAt.format(ID_TIME_FORMAT);
    }

    /**
     * 内容与哈希是否一致
     */
    public boolean verify() {
        return content != null && contentHash != null && contentHash.equals(sha256(content));
    }

    public static String sha256(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 不可用", e);
        }
    }

    public String getId() {
        return id;
    }

    public String getDeviceName() {
        return deviceName;
    }

    public LocalDateTime getCapturedAt() {
        return capturedAt;
    }

    public String getContent() {
        return content;
    }

    public String getContentHash() {
        return contentHash;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BackupSnapshot that = (BackupSnapshot) o;
        return id.equals(that.id) && Objects.equals(contentHash, that.contentHash);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, contentHash);
    }

    @Override
    public String toString() {
        return "BackupSnapshot{" + id + ", hash=" + (contentHash != null ? contentHash.substring(0, Math.min(12, contentHash.length())) : null) + '}';
    }
}
