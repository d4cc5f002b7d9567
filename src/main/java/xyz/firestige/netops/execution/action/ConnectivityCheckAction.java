package xyz.firestige.netops.execution.action;

import java.util.List;

import xyz.firestige.netops.domain.device.Device;
import xyz.firestige.netops.domain.intent.Directive;
import xyz.firestige.netops.driver.DeviceDriver;
import xyz.firestige.netops.driver.DeviceDriverRegistry;
import xyz.firestige.netops.execution.DeviceAction;
import xyz.firestige.netops.execution.RunContext;
import xyz.firestige.netops.session.DeviceSession;
import xyz.firestige.netops.session.DeviceSessionFactory;

/**
 * 连通性预检：建立会话并读取 hostname 行
 */
public class ConnectivityCheckAction implements DeviceAction {

    private final DeviceDriverRegistry driverRegistry;
    private final DeviceSessionFactory sessionFactory;

    public ConnectivityCheckAction(DeviceDriverRegistry driverRegistry, DeviceSessionFactory sessionFactory) {
        this.driverRegistry = driverRegistry;
        this.sessionFactory = sessionFactory;
    }

    @Override
    public String apply(Device device, List<Directive> directives, RunContext ctx) {
        DeviceDriver driver = driverRegistry.require(device.getKind());
        try (DeviceSession session = sessionFactory.connect(device)) {
            String output = session.execute(driver.hostnameCommand());
            return output == null ? "" : output.strip();
        }
    }
}
