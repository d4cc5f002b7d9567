package xyz.firestige.netops.driver;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 驱动注册表：设备类型标签 → 驱动
 * <p>
 * 驱动在构建阶段动作时选定一次，执行期间不再做类型判断。
 */
public class DeviceDriverRegistry {

    private static final Logger log = LoggerFactory.getLogger(DeviceDriverRegistry.class);

    private final Map<String, DeviceDriver> drivers = new HashMap<>();

    public DeviceDriverRegistry(Collection<? extends DeviceDriver> drivers) {
        for (DeviceDriver driver : drivers) {
            for (String kind : driver.supportedKinds()) {
                DeviceDriver previous = this.drivers.put(kind, driver);
                if (previous != null) {
                    log.warn("设备类型 {} 的驱动被覆盖: {} -> {}", kind,
                            previous.getClass().getSimpleName(), driver.getClass().getSimpleName());
                }
            }
        }
        log.info("已注册设备驱动, kinds: {}", this.drivers.keySet());
    }

    public Optional<DeviceDriver> find(String kind) {
        return kind == null ? Optional.empty() : Optional.ofNullable(drivers.get(kind));
    }

    public DeviceDriver require(String kind) {
        return find(kind).orElseThrow(() -> new IllegalArgumentException("未注册的设备类型: " + kind));
    }

    public boolean supports(String kind) {
        return kind != null && drivers.containsKey(kind);
    }

    public Set<String> kinds() {
        return Set.copyOf(drivers.keySet());
    }
}
