package xyz.firestige.netops.execution.action;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import xyz.firestige.netops.backup.BackupStore;
import xyz.firestige.netops.domain.device.Device;
import xyz.firestige.netops.domain.intent.Directive;
import xyz.firestige.netops.driver.DeviceDriver;
import xyz.firestige.netops.driver.DeviceDriverRegistry;
import xyz.firestige.netops.exception.SnapshotNotFoundException;
import xyz.firestige.netops.execution.DeviceAction;
import xyz.firestige.netops.execution.RunContext;
import xyz.firestige.netops.session.DeviceSession;
import xyz.firestige.netops.session.DeviceSessionFactory;

/**
 * 回滚：从备份存储取出指定快照正文，作为配置行重新下发并保存
 */
public class RollbackAction implements DeviceAction {

    private static final Logger log = LoggerFactory.getLogger(RollbackAction.class);

    private final BackupStore backupStore;
    private final DeviceDriverRegistry driverRegistry;
    private final DeviceSessionFactory sessionFactory;
    private final Map<String, String> snapshotIds;

    /**
     * @param snapshotIds 设备名 → 要恢复的快照 id
     */
    public RollbackAction(BackupStore backupStore, DeviceDriverRegistry driverRegistry,
                          DeviceSessionFactory sessionFactory, Map<String, String> snapshotIds) {
        this.backupStore = backupStore;
        this.driverRegistry = driverRegistry;
        this.sessionFactory = sessionFactory;
        this.snapshotIds = Map.copyOf(snapshotIds);
    }

    @Override
    public String apply(Device device, List<Directive> directives, RunContext ctx) {
        String snapshotId = snapshotIds.get(device.getName());
        if (snapshotId == null) {
            throw new SnapshotNotFoundException(device.getName(), "<unspecified>");
        }
        String content = backupStore.restore(device.getName(), snapshotId);
        DeviceDriver driver = driverRegistry.require(device.getKind());
        List<String> commands = driver.restoreCommands(content);
        try (DeviceSession session = sessionFactory.connect(device)) {
            driver.checkOutput("restore " + snapshotId, session.executeConfig(commands));
            String saveCommand = driver.saveCommand();
            driver.checkOutput(saveCommand, session.execute(saveCommand));
        }
        log.info("快照已重新下发, device: {}, snapshot: {}, 行数: {}", device.getName(), snapshotId, commands.size());
        return snapshotId;
    }
}
