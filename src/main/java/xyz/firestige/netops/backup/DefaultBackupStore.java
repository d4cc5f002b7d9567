package xyz.firestige.netops.backup;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import xyz.firestige.netops.domain.backup.BackupRepository;
import xyz.firestige.netops.domain.backup.BackupSnapshot;
import xyz.firestige.netops.domain.device.Device;
import xyz.firestige.netops.event.BackupCapturedEvent;
import xyz.firestige.netops.exception.CaptureException;
import xyz.firestige.netops.exception.ConnectionException;
import xyz.firestige.netops.exception.NetOpsException;
import xyz.firestige.netops.exception.SnapshotNotFoundException;
import xyz.firestige.netops.execution.RunContext;
import xyz.firestige.netops.metrics.MetricNames;

/**
 * 默认备份存储：{@link StateCollector} 负责拉取，{@link BackupRepository} 负责持久化
 *
 * <p>每台设备一把锁，只包住时间戳分配与追加，设备会话 I/O 在锁外进行，
 * 不同设备之间不会竞争。同一设备的采集时间严格递增（同一毫秒内的第二次采集顺延 1ms）。
 * 已超时被放弃的采集尝试在锁内被拦下，历史与 latest 保持不变。
 */
public class DefaultBackupStore implements BackupStore {

    private static final Logger log = LoggerFactory.getLogger(DefaultBackupStore.class);

    private final StateCollector collector;
    private final BackupRepository repository;
    private final Clock clock;
    private final Map<String, Object> deviceLocks = new ConcurrentHashMap<>();

    public DefaultBackupStore(StateCollector collector, BackupRepository repository) {
        this(collector, repository, Clock.systemDefaultZone());
    }

    public DefaultBackupStore(StateCollector collector, BackupRepository repository, Clock clock) {
        this.collector = collector;
        this.repository = repository;
        this.clock = clock;
    }

    @Override
    public BackupSnapshot capture(Device device, RunContext ctx) {
        String deviceName = device.getName();
        CollectedState state;
        try {
            state = collector.collect(device);
        } catch (ConnectionException | CaptureException e) {
            ctx.getMetrics().incrementCounter(MetricNames.BACKUP_FAILED);
            throw e;
        } catch (RuntimeException e) {
            ctx.getMetrics().incrementCounter(MetricNames.BACKUP_FAILED);
            throw new CaptureException("拉取设备状态失败: " + deviceName, e);
        }

        BackupSnapshot snapshot;
        synchronized (lockOf(deviceName)) {
            if (!ctx.beginCommit()) {
                ctx.getMetrics().incrementCounter(MetricNames.BACKUP_FAILED);
                throw new CaptureException("采集尝试已超时被放弃，不提交快照: " + deviceName);
            }
            LocalDateTime capturedAt = nextTimestamp(deviceName);
            snapshot = BackupSnapshot.create(deviceName, capturedAt, collector.compose(device, state, capturedAt));
            try {
                repository.append(snapshot);
            } catch (NetOpsException e) {
                ctx.getMetrics().incrementCounter(MetricNames.BACKUP_FAILED);
                throw e;
            } catch (RuntimeException e) {
                ctx.getMetrics().incrementCounter(MetricNames.BACKUP_FAILED);
                throw new CaptureException("持久化快照失败: " + snapshot.getId(), e);
            }
        }

        ctx.getMetrics().incrementCounter(MetricNames.BACKUP_CAPTURED);
        ctx.publish(new BackupCapturedEvent(ctx.getRunId(), deviceName, snapshot.getId(), snapshot.getContentHash()));
        log.info("备份完成, device: {}, snapshot: {}", deviceName, snapshot.getId());
        return snapshot;
    }

    private LocalDateTime nextTimestamp(String deviceName) {
        LocalDateTime now = LocalDateTime.now(clock).truncatedTo(ChronoUnit.MILLIS);
        Optional<BackupSnapshot> last = repository.latest(deviceName);
        if (last.isPresent() && !now.isAfter(last.get().getCapturedAt())) {
            return last.get().getCapturedAt().plus(1, ChronoUnit.MILLIS);
        }
        return now;
    }

    private Object lockOf(String deviceName) {
        return deviceLocks.computeIfAbsent(deviceName, k -> new Object());
    }

    @Override
    public String restore(String deviceName, String snapshotId) {
        BackupSnapshot snapshot = repository.find(deviceName, snapshotId)
                .orElseThrow(() -> new SnapshotNotFoundException(deviceName, snapshotId));
        if (!snapshot.verify()) {
            throw new CaptureException("快照内容与哈希不一致: " + snapshotId);
        }
        return snapshot.getContent();
    }

    @Override
    public List<BackupSnapshot> history(String deviceName) {
        return repository.history(deviceName);
    }

    @Override
    public Optional<BackupSnapshot> latest(String deviceName) {
        return repository.latest(deviceName);
    }
}
