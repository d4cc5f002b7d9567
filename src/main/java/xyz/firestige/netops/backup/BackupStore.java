package xyz.firestige.netops.backup;

import java.util.List;
import java.util.Optional;

import xyz.firestige.netops.domain.backup.BackupSnapshot;
import xyz.firestige.netops.domain.device.Device;
import xyz.firestige.netops.execution.RunContext;

/**
 * 备份存储
 * <p>
 * 采集成功时追加历史并原子地移动 latest 指针；采集失败时历史与 latest 均不变。
 * 本组件不自动重试，重试策略属于调用它的阶段动作。
 */
public interface BackupStore {

    /**
     * 采集设备当前运行配置并持久化
     *
     * @throws xyz.firestige.netops.exception.ConnectionException 会话建立失败（可由阶段重试）
     * @throws xyz.firestige.netops.exception.CaptureException    采集或持久化失败
     */
    BackupSnapshot capture(Device device, RunContext ctx);

    /**
     * 返回历史快照内容，供回滚动作重新下发；本方法本身不触碰设备
     *
     * @throws xyz.firestige.netops.exception.SnapshotNotFoundException 快照不存在
     */
    String restore(String deviceName, String snapshotId);

    List<BackupSnapshot> history(String deviceName);

    Optional<BackupSnapshot> latest(String deviceName);
}
