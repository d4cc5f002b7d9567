package xyz.firestige.netops.execution.action;

import java.util.List;

import xyz.firestige.netops.backup.BackupStore;
import xyz.firestige.netops.domain.backup.BackupSnapshot;
import xyz.firestige.netops.domain.device.Device;
import xyz.firestige.netops.domain.intent.Directive;
import xyz.firestige.netops.execution.DeviceAction;
import xyz.firestige.netops.execution.RunContext;

public class BackupCaptureAction implements DeviceAction {

    private final BackupStore backupStore;

    public BackupCaptureAction(BackupStore backupStore) {
        this.backupStore = backupStore;
    }

    @Override
    public String apply(Device device, List<Directive> directives, RunContext ctx) {
        BackupSnapshot snapshot = backupStore.capture(device, ctx);
        return snapshot.getId();
    }
}
