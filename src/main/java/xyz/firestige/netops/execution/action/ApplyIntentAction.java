package xyz.firestige.netops.execution.action;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import xyz.firestige.netops.domain.device.Device;
import xyz.firestige.netops.domain.intent.Directive;
import xyz.firestige.netops.domain.intent.Stage;
import xyz.firestige.netops.driver.DeviceDriver;
import xyz.firestige.netops.driver.DeviceDriverRegistry;
import xyz.firestige.netops.exception.ErrorType;
import xyz.firestige.netops.exception.NetOpsException;
import xyz.firestige.netops.execution.DeviceAction;
import xyz.firestige.netops.execution.RunContext;
import xyz.firestige.netops.session.DeviceSession;
import xyz.firestige.netops.session.DeviceSessionFactory;

/**
 * 下发一个配置阶段的指令：连接 → 逐条下发 → 执行校验命令 → 保存
 * <p>
 * 指令切片为空时不连接设备，直接成功。
 */
public class ApplyIntentAction implements DeviceAction {

    private static final Logger log = LoggerFactory.getLogger(ApplyIntentAction.class);

    private final Stage stage;
    private final DeviceDriverRegistry driverRegistry;
    private final DeviceSessionFactory sessionFactory;

    public ApplyIntentAction(Stage stage, DeviceDriverRegistry driverRegistry, DeviceSessionFactory sessionFactory) {
        this.stage = stage;
        this.driverRegistry = driverRegistry;
        this.sessionFactory = sessionFactory;
    }

    @Override
    public String apply(Device device, List<Directive> directives, RunContext ctx) {
        if (directives.isEmpty()) {
            return "无待下发配置";
        }
        DeviceDriver driver = driverRegistry.require(device.getKind());
        try (DeviceSession session = sessionFactory.connect(device)) {
            for (Directive directive : directives) {
                ensureLive(device, ctx);
                List<String> commands = driver.render(directive);
                String output = session.executeConfig(commands);
                driver.checkOutput(String.join("; ", commands), output);
                log.debug("指令已下发: {}", directive.describe());
            }
            for (String command : driver.verificationCommands(stage)) {
                String output = session.execute(command);
                driver.checkOutput(command, output);
                log.debug("校验输出 [{}]:\n{}", command, output);
            }
            ensureLive(device, ctx);
            String saveCommand = driver.saveCommand();
            driver.checkOutput(saveCommand, session.execute(saveCommand));
        }
        return "已下发 " + directives.size() + " 条" + stage.getPhaseName() + "指令";
    }

    /**
     * 超时被放弃的尝试不再继续下发或保存
     */
    private void ensureLive(Device device, RunContext ctx) {
        if (ctx.isAttemptAbandoned()) {
            throw new NetOpsException(ErrorType.TIMEOUT_ERROR, "下发尝试已超时被放弃: " + device.getName());
        }
    }

    public Stage getStage() {
        return stage;
    }
}
