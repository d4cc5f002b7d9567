package xyz.firestige.netops.infrastructure.persistence.backup;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;

import xyz.firestige.netops.domain.backup.BackupSnapshot;
import xyz.firestige.netops.exception.CaptureException;
import xyz.firestige.netops.testutil.TimingExtension;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
@ExtendWith(TimingExtension.class)
@DisplayName("FileSystemBackupRepository 单元测试")
class FileSystemBackupRepositoryTest {

    private static final LocalDateTime T1 = LocalDateTime.of(2026, 10, 18, 9, 0, 0);
    private static final LocalDateTime T2 = T1.plusSeconds(30);

    @TempDir
    Path dir;

    @Test
    @DisplayName("场景: 追加快照 - 写入快照文件、latest 与索引")
    void testAppendWritesFiles() throws IOException {
        // Given
        FileSystemBackupRepository repository = new FileSystemBackupRepository(dir, true);
        BackupSnapshot snapshot = BackupSnapshot.create("R1", T1, "hostname R1\n");

        // When
        repository.append(snapshot);

        // Then
        assertEquals("hostname R1\n", Files.readString(dir.resolve("R1_20261018_090000_000.txt"), StandardCharsets.UTF_8));
        assertEquals("hostname R1\n", Files.readString(dir.resolve("R1_latest.txt"), StandardCharsets.UTF_8));
        String index = Files.readString(dir.resolve("README.md"), StandardCharsets.UTF_8);
        assertTrue(index.startsWith("# Router Configuration Backups"));
        assertTrue(index.contains("[R1_latest.txt](R1_latest.txt)"));
    }

    @Test
    @DisplayName("场景: 重新打开目录后历史与 latest 可读")
    void testReopen() {
        // Given
        FileSystemBackupRepository writer = new FileSystemBackupRepository(dir, false);
        BackupSnapshot first = BackupSnapshot.create("R1", T1, "hostname R1\n! v1\n");
        BackupSnapshot second = BackupSnapshot.create("R1", T2, "hostname R1\n! v2\n");
        writer.append(first);
        writer.append(second);
        writer.append(BackupSnapshot.create("R2", T1, "hostname R2\n"));

        // When
        FileSystemBackupRepository reader = new FileSystemBackupRepository(dir, false);

        // Then
        List<BackupSnapshot> history = reader.history("R1");
        assertEquals(List.of(first.getId(), second.getId()), List.of(history.get(0).getId(), history.get(1).getId()));
        assertTrue(history.stream().allMatch(BackupSnapshot::verify));
        assertEquals(second.getId(), reader.latest("R1").orElseThrow().getId());
        assertEquals(first.getContent(), reader.find("R1", first.getId()).orElseThrow().getContent());
        assertFalse(Files.exists(dir.resolve("README.md")));
    }

    @Test
    @DisplayName("场景: 同名快照已存在 - 拒绝覆盖，latest 不变")
    void testRejectOverwrite() throws IOException {
        FileSystemBackupRepository repository = new FileSystemBackupRepository(dir, false);
        repository.append(BackupSnapshot.create("R1", T1, "hostname R1\n"));

        assertThrows(CaptureException.class,
                () -> repository.append(BackupSnapshot.create("R1", T1, "hostname R1-changed\n")));

        assertEquals("hostname R1\n", Files.readString(dir.resolve("R1_latest.txt"), StandardCharsets.UTF_8));
        assertEquals(1, repository.history("R1").size());
    }

    @Test
    @DisplayName("场景: latest 指针无法替换 - 快照文件回滚，历史与 latest 不变")
    void testLatestReplaceFailureRollsBack() throws IOException {
        // Given: 已有一份快照，随后 latest 位置被一个非空目录占住
        FileSystemBackupRepository repository = new FileSystemBackupRepository(dir, false);
        BackupSnapshot first = BackupSnapshot.create("R1", T1, "hostname R1\n! v1\n");
        repository.append(first);
        Path latest = dir.resolve("R1_latest.txt");
        Files.delete(latest);
        Files.createDirectory(latest);
        Files.writeString(latest.resolve("pinned.txt"), "keep", StandardCharsets.UTF_8);

        // When
        BackupSnapshot second = BackupSnapshot.create("R1", T2, "hostname R1\n! v2\n");
        assertThrows(CaptureException.class, () -> repository.append(second));

        // Then: 新快照文件已删除，没有残留临时文件
        assertFalse(Files.exists(dir.resolve(second.getId() + ".txt")));
        assertEquals(List.of(first.getId()),
                repository.history("R1").stream().map(BackupSnapshot::getId).collect(Collectors.toList()));
        try (Stream<Path> files = Files.list(dir)) {
            assertTrue(files.noneMatch(f -> f.getFileName().toString().endsWith(".part")));
        }
        assertEquals("keep", Files.readString(latest.resolve("pinned.txt"), StandardCharsets.UTF_8));

        // 恢复 latest 文件后仍指向第一份快照
        Files.delete(latest.resolve("pinned.txt"));
        Files.delete(latest);
        Files.writeString(latest, first.getContent(), StandardCharsets.UTF_8);
        assertEquals(first.getId(), repository.latest("R1").get().getId());
    }

    @Test
    @DisplayName("场景: 没有任何备份的设备")
    void testEmpty() {
        FileSystemBackupRepository repository = new FileSystemBackupRepository(dir, true);

        assertTrue(repository.history("R9").isEmpty());
        assertTrue(repository.latest("R9").isEmpty());
        assertTrue(repository.find("R9", "R9_20261018_090000_000").isEmpty());
    }

    @Test
    @DisplayName("场景: 目录中的无关文件被忽略")
    void testIgnoresUnrelatedFiles() throws IOException {
        FileSystemBackupRepository repository = new FileSystemBackupRepository(dir, false);
        Files.writeString(dir.resolve("R1_notes.txt"), "notes");
        Files.writeString(dir.resolve("R1_99999999_999999_999.txt"), "garbage");

        repository.append(BackupSnapshot.create("R1", T1, "hostname R1\n"));

        assertEquals(1, repository.history("R1").size());
    }
}
