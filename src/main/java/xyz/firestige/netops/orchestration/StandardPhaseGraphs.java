package xyz.firestige.netops.orchestration;

import java.util.Map;

import xyz.firestige.netops.backup.BackupStore;
import xyz.firestige.netops.domain.intent.Stage;
import xyz.firestige.netops.driver.DeviceDriverRegistry;
import xyz.firestige.netops.execution.action.ApplyIntentAction;
import xyz.firestige.netops.execution.action.BackupCaptureAction;
import xyz.firestige.netops.execution.action.ConnectivityCheckAction;
import xyz.firestige.netops.execution.action.RollbackAction;
import xyz.firestige.netops.session.DeviceSessionFactory;

/**
 * 内置阶段图
 *
 * <pre>
 * [connectivity] → interfaces → routing ─┐
 *                            └→ vlans  ──┴→ backup
 * </pre>
 * 校验在图之前、报告在图之后执行，它们是运行的边界而不是阶段。
 */
public final class StandardPhaseGraphs {

    public static final String CONNECTIVITY = "connectivity";
    public static final String INTERFACES = Stage.INTERFACES.getPhaseName();
    public static final String ROUTING = Stage.ROUTING.getPhaseName();
    public static final String VLANS = Stage.VLANS.getPhaseName();
    public static final String BACKUP = "backup";
    public static final String ROLLBACK = "rollback";

    private StandardPhaseGraphs() {
    }

    public static PhaseGraph configurationRun(DeviceDriverRegistry driverRegistry,
                                              DeviceSessionFactory sessionFactory,
                                              BackupStore backupStore,
                                              boolean connectivityCheck) {
        PhaseGraph.Builder builder = PhaseGraph.builder();
        PhaseDefinition.Builder interfaces = PhaseDefinition.builder(INTERFACES)
                .stage(Stage.INTERFACES)
                .action(new ApplyIntentAction(Stage.INTERFACES, driverRegistry, sessionFactory));
        if (connectivityCheck) {
            builder.phase(PhaseDefinition.builder(CONNECTIVITY)
                    .action(new ConnectivityCheckAction(driverRegistry, sessionFactory))
                    .build());
            interfaces.dependsOn(CONNECTIVITY);
        }
        return builder
                .phase(interfaces.build())
                .phase(PhaseDefinition.builder(ROUTING)
                        .dependsOn(INTERFACES)
                        .stage(Stage.ROUTING)
                        .action(new ApplyIntentAction(Stage.ROUTING, driverRegistry, sessionFactory))
                        .build())
                .phase(PhaseDefinition.builder(VLANS)
                        .dependsOn(INTERFACES)
                        .stage(Stage.VLANS)
                        .action(new ApplyIntentAction(Stage.VLANS, driverRegistry, sessionFactory))
                        .build())
                .phase(PhaseDefinition.builder(BACKUP)
                        .dependsOn(ROUTING, VLANS)
                        .action(new BackupCaptureAction(backupStore))
                        .build())
                .build();
    }

    /**
     * @param snapshotIds 设备名 → 快照 id，只有出现在这里的设备参与回滚
     */
    public static PhaseGraph rollbackRun(DeviceDriverRegistry driverRegistry,
                                         DeviceSessionFactory sessionFactory,
                                         BackupStore backupStore,
                                         Map<String, String> snapshotIds) {
        return PhaseGraph.builder()
                .phase(PhaseDefinition.builder(ROLLBACK)
                        .devices(snapshotIds.keySet())
                        .action(new RollbackAction(backupStore, driverRegistry, sessionFactory, snapshotIds))
                        .build())
                .build();
    }
}
