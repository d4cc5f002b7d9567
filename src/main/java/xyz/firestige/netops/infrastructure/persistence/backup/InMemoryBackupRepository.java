package xyz.firestige.netops.infrastructure.persistence.backup;

import xyz.firestige.netops.domain.backup.BackupRepository;
import xyz.firestige.netops.domain.backup.BackupSnapshot;
import xyz.firestige.netops.exception.CaptureException;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 内存实现，默认存储。
 * <p>
 * latest 是一个 {@link AtomicReference}，只在快照进入历史之后才切换。
 */
public class InMemoryBackupRepository implements BackupRepository {

    private final Map<String, DeviceHistory> store = new ConcurrentHashMap<>();

    @Override
    public void append(BackupSnapshot snapshot) {
        if (!snapshot.verify()) {
            throw new CaptureException("快照哈希校验失败: " + snapshot.getId());
        }
        DeviceHistory history = store.computeIfAbsent(snapshot.getDeviceName(), k -> new DeviceHistory());
        synchronized (history) {
            BackupSnapshot current = history.latest.get();
            if (current != null && !snapshot.getCapturedAt().isAfter(current.getCapturedAt())) {
                throw new CaptureException("快照时间戳未递增: " + snapshot.getId());
            }
            history.snapshots.add(snapshot);
            history.latest.set(snapshot);
        }
    }

    @Override
    public List<BackupSnapshot> history(String deviceName) {
        DeviceHistory history = store.get(deviceName);
        return history == null ? List.of() : List.copyOf(history.snapshots);
    }

    @Override
    public Optional<BackupSnapshot> latest(String deviceName) {
        DeviceHistory history = store.get(deviceName);
        return history == null ? Optional.empty() : Optional.ofNullable(history.latest.get());
    }

    @Override
    public Optional<BackupSnapshot> find(String deviceName, String snapshotId) {
        return history(deviceName).stream()
                .filter(s -> s.getId().equals(snapshotId))
                .findFirst();
    }

    private static final class DeviceHistory {
        private final List<BackupSnapshot> snapshots = new CopyOnWriteArrayList<>();
        private final AtomicReference<BackupSnapshot> latest = new AtomicReference<>();
    }
}
