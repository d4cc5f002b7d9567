package xyz.firestige.netops.backup;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import xyz.firestige.netops.domain.device.Device;
import xyz.firestige.netops.driver.DeviceDriver;
import xyz.firestige.netops.driver.DeviceDriverRegistry;
import xyz.firestige.netops.exception.CaptureException;
import xyz.firestige.netops.session.DeviceSession;
import xyz.firestige.netops.session.DeviceSessionFactory;

/**
 * 通过设备会话拉取运行配置，并拼装带头部信息的快照正文
 */
public class StateCollector {

    private static final Logger log = LoggerFactory.getLogger(StateCollector.class);

    static final DateTimeFormatter HEADER_TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final String SEPARATOR = "-".repeat(70);

    private final DeviceDriverRegistry driverRegistry;
    private final DeviceSessionFactory sessionFactory;

    public StateCollector(DeviceDriverRegistry driverRegistry, DeviceSessionFactory sessionFactory) {
        this.driverRegistry = driverRegistry;
        this.sessionFactory = sessionFactory;
    }

    /**
     * 拉取设备状态；连接失败以 ConnectionException 原样抛出
     */
    public CollectedState collect(Device device) {
        DeviceDriver driver = driverRegistry.require(device.getKind());
        try (DeviceSession session = sessionFactory.connect(device)) {
            String runningConfig = session.execute(driver.runningConfigCommand());
            if (runningConfig == null || runningConfig.isBlank()) {
                throw new CaptureException("设备返回了空的运行配置: " + device.getName());
            }
            String version = session.execute(driver.versionCommand());
            log.debug("已拉取运行配置, device: {}, 长度: {}", device.getName(), runningConfig.length());
            return new CollectedState(runningConfig, version == null ? "" : version.strip());
        }
    }

    /**
     * 快照正文 = 头部（备份时间、设备、地址、版本）+ 运行配置
     */
    public String compose(Device device, CollectedState state, LocalDateTime capturedAt) {
        StringBuilder sb = new StringBuilder();
        sb.append("! Backup Date: ").append(capturedAt.format(HEADER_TIME_FORMAT)).append('\n');
        sb.append("! Router: ").append(device.getName()).append('\n');
        sb.append("! IP Address: ").append(device.getAddress()).append('\n');
        sb.append("! ").append(state.versionLine()).append('\n');
        sb.append("!\n");
        sb.append("! ").append(SEPARATOR).append('\n');
        sb.append("!\n");
        sb.append(state.runningConfig());
        return sb.toString();
    }
}
