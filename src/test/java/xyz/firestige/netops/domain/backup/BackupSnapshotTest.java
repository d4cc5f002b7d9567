package xyz.firestige.netops.domain.backup;

import java.time.LocalDateTime;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import xyz.firestige.netops.testutil.TimingExtension;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
@Tag("fast")
@ExtendWith(TimingExtension.class)
@DisplayName("BackupSnapshot 单元测试")
class BackupSnapshotTest {

    private static final LocalDateTime AT = LocalDateTime.of(2026, 10, 18, 9, 30, 15, 42_000_000);

    @Test
    @DisplayName("场景: id 由设备名与毫秒级采集时间组成")
    void testId() {
        BackupSnapshot snapshot = BackupSnapshot.create("R1", AT, "hostname R1\n");

        assertEquals("R1_20261018_093015_042", snapshot.getId());
        assertEquals(BackupSnapshot.idOf("R1", AT), snapshot.getId());
    }

    @Test
    @DisplayName("场景: 内容与哈希一致时校验通过")
    void testVerify() {
        BackupSnapshot snapshot = BackupSnapshot.create("R1", AT, "hostname R1\n");

        assertTrue(snapshot.verify());
        assertEquals(64, snapshot.getContentHash().length());
    }

    @Test
    @DisplayName("场景: 还原时内容被篡改 - 校验失败")
    void testVerifyTampered() {
        BackupSnapshot original = BackupSnapshot.create("R1", AT, "hostname R1\n");

        BackupSnapshot tampered = BackupSnapshot.restore("R1", AT, "hostname R2\n", original.getContentHash());

        assertFalse(tampered.verify());
        assertFalse(BackupSnapshot.restore("R1", AT, "hostname R1\n", null).verify());
    }
}
