package xyz.firestige.netops.domain.backup;

import java.util.List;
import java.util.Optional;

/**
 * 快照存储端口
 * <p>
 * 每台设备两类数据：只追加的有序历史，以及一个指向最近成功快照的 latest 指针。
 * 实现必须保证：
 * <ul>
 *   <li>{@link #append(BackupSnapshot)} 要么同时完成追加与指针切换，要么都不发生</li>
 *   <li>并发读取 latest 不会看到写了一半或哈希不匹配的快照</li>
 *   <li>不同设备之间互不阻塞</li>
 * </ul>
 */
public interface BackupRepository {

    /**
     * 追加快照并切换 latest 指针
     *
     * @throws xyz.firestige.netops.exception.CaptureException 持久化失败时，历史与指针保持不变
     */
    void append(BackupSnapshot snapshot);

    /**
     * 按采集时间升序的全部历史
     */
    List<BackupSnapshot> history(String deviceName);

    Optional<BackupSnapshot> latest(String deviceName);

    Optional<BackupSnapshot> find(String deviceName, String snapshotId);
}
