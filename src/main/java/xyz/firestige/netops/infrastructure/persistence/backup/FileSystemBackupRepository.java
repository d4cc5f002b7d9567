package xyz.firestige.netops.infrastructure.persistence.backup;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.netops.domain.backup.BackupRepository;
import xyz.firestige.netops.domain.backup.BackupSnapshot;
import xyz.firestige.netops.exception.CaptureException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 文件系统实现
 *
 * <p>目录布局：
 * <pre>
 * backups/
 *   R1_20240101_120000_000.txt   每次采集一个文件，写入后不再修改
 *   R1_latest.txt                latest 指针，内容为最近一次成功快照的副本
 *   README.md                    最新备份索引（可选）
 * </pre>
 *
 * <p>所有文件先写临时文件再原子移动；快照文件回读校验哈希通过后才替换 latest，
 * 替换失败会删除刚写入的快照文件，保证历史与指针同进同退。
 */
public class FileSystemBackupRepository implements BackupRepository {

    private static final Logger log = LoggerFactory.getLogger(FileSystemBackupRepository.class);

    static final String LATEST_SUFFIX = "_latest.txt";
    static final String INDEX_FILE = "README.md";
    private static final Pattern SNAPSHOT_FILE = Pattern.compile("^(.+)_(\\d{8}_\\d{6}_\\d{3})\\.txt$");
    private static final DateTimeFormatter INDEX_TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Path directory;
    private final boolean writeIndex;
    private final Map<String, Object> deviceLocks = new ConcurrentHashMap<>();
    private final Object indexLock = new Object();

    public FileSystemBackupRepository(Path directory, boolean writeIndex) {
        this.directory = directory;
        this.writeIndex = writeIndex;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("无法创建备份目录: " + directory, e);
        }
    }

    @Override
    public void append(BackupSnapshot snapshot) {
        String deviceName = snapshot.getDeviceName();
        Path snapshotFile = directory.resolve(snapshot.getId() + ".txt");
        synchronized (lockOf(deviceName)) {
            if (Files.exists(snapshotFile)) {
                throw new CaptureException("快照文件已存在，拒绝覆盖: " + snapshotFile.getFileName());
            }
            try {
                writeAtomically(snapshotFile, snapshot.getContent());
            } catch (IOException e) {
                throw new CaptureException("写入快照文件失败: " + snapshotFile.getFileName(), e);
            }

            try {
                String stored = Files.readString(snapshotFile, StandardCharsets.UTF_8);
                if (!snapshot.getContentHash().equals(BackupSnapshot.sha256(stored))) {
                    throw new CaptureException("快照回读哈希不一致: " + snapshot.getId());
                }
                writeAtomically(latestFile(deviceName), stored);
            } catch (IOException | RuntimeException e) {
                deleteQuietly(snapshotFile);
                if (e instanceof CaptureException) {
                    throw (CaptureException) e;
                }
                throw new CaptureException("更新 latest 指针失败: " + deviceName, e);
            }
        }
        log.info("快照已写入, file: {}", snapshotFile.getFileName());

        if (writeIndex) {
            writeIndex();
        }
    }

    @Override
    public List<BackupSnapshot> history(String deviceName) {
        List<BackupSnapshot> snapshots = new ArrayList<>();
        try (Stream<Path> files = Files.list(directory)) {
            for (Path file : files.sorted(Comparator.comparing(Path::toString)).collect(Collectors.toList())) {
                Matcher m = SNAPSHOT_FILE.matcher(file.getFileName().toString());
                if (m.matches() && m.group(1).equals(deviceName)) {
                    LocalDateTime capturedAt = parseTime(m.group(2));
                    if (capturedAt != null) {
                        String content = Files.readString(file, StandardCharsets.UTF_8);
                        snapshots.add(BackupSnapshot.restore(deviceName, capturedAt, content, BackupSnapshot.sha256(content)));
                    }
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("读取备份目录失败: " + directory, e);
        }
        snapshots.sort(Comparator.comparing(BackupSnapshot::getCapturedAt));
        return snapshots;
    }

    /**
     * 读取 latest 文件，并在历史中从新到旧找到内容一致的快照
     */
    @Override
    public Optional<BackupSnapshot> latest(String deviceName) {
        Path latest = latestFile(deviceName);
        if (!Files.exists(latest)) {
            return Optional.empty();
        }
        String hash;
        try {
            hash = BackupSnapshot.sha256(Files.readString(latest, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("读取 latest 失败: " + latest, e);
        }
        List<BackupSnapshot> history = history(deviceName);
        for (int i = history.size() - 1; i >= 0; i--) {
            if (history.get(i).getContentHash().equals(hash)) {
                return Optional.of(history.get(i));
            }
        }
        log.warn("latest 指针找不到对应的历史快照, device: {}", deviceName);
        return Optional.empty();
    }

    @Override
    public Optional<BackupSnapshot> find(String deviceName, String snapshotId) {
        return history(deviceName).stream()
                .filter(s -> s.getId().equals(snapshotId))
                .findFirst();
    }

    private void writeIndex() {
        synchronized (indexLock) {
            try (Stream<Path> files = Files.list(directory)) {
                List<String> latestFiles = files
                        .map(p -> p.getFileName().toString())
                        .filter(name -> name.endsWith(LATEST_SUFFIX))
                        .sorted()
                        .collect(Collectors.toList());
                StringBuilder sb = new StringBuilder();
                sb.append("# Router Configuration Backups\n\n");
                sb.append("Last updated: ").append(LocalDateTime.now().format(INDEX_TIME_FORMAT)).append("\n\n");
                sb.append("## Latest Backups\n\n");
                for (String file : latestFiles) {
                    String device = file.substring(0, file.length() - LATEST_SUFFIX.length());
                    sb.append("- **").append(device).append("**: [").append(file).append("](").append(file).append(")\n");
                }
                sb.append("\n## Backup Naming Convention\n\n");
                sb.append("- Format: `{RouterName}_{YYYYMMDD_HHMMSS_SSS}.txt`\n");
                sb.append("- Latest: `{RouterName}_latest.txt`\n");
                writeAtomically(directory.resolve(INDEX_FILE), sb.toString());
            } catch (IOException e) {
                // 索引只是辅助信息，不影响快照本身
                log.warn("写入备份索引失败: {}", e.getMessage());
            }
        }
    }

    private void writeAtomically(Path target, String content) throws IOException {
        Path tmp = Files.createTempFile(directory, ".tmp-", ".part");
        try {
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.error("回滚快照文件失败: {}", file, e);
        }
    }

    private static LocalDateTime parseTime(String text) {
        try {
            return LocalDateTime.parse(text, BackupSnapshot.ID_TIME_FORMAT);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private Path latestFile(String deviceName) {
        return directory.resolve(deviceName + LATEST_SUFFIX);
    }

    private Object lockOf(String deviceName) {
        return deviceLocks.computeIfAbsent(deviceName, k -> new Object());
    }

    public Path getDirectory() {
        return directory;
    }
}
