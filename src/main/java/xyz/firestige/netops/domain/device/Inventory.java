package xyz.firestige.netops.domain.device;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 设备清单
 * <p>
 * 有序、按名称唯一、加载后只读。任何组件都不会修改 Inventory。
 */
public final class Inventory {

    private final Map<String, Device> devices;

    private Inventory(Map<String, Device> devices) {
        this.devices = Collections.unmodifiableMap(devices);
    }

    public static Inventory of(Collection<Device> devices) {
        Map<String, Device> byName = new LinkedHashMap<>();
        for (Device device : devices) {
            if (byName.putIfAbsent(device.getName(), device) != null) {
                throw new IllegalArgumentException("设备名重复: " + device.getName());
            }
        }
        return new Inventory(byName);
    }

    public static Inventory of(Device... devices) {
        return of(List.of(devices));
    }

    public static Inventory empty() {
        return new Inventory(new LinkedHashMap<>());
    }

    public List<Device> devices() {
        return List.copyOf(devices.values());
    }

    public Optional<Device> find(String name) {
        return Optional.ofNullable(devices.get(name));
    }

    public Device require(String name) {
        Device device = devices.get(name);
        if (device == null) {
            throw new IllegalArgumentException("设备不在清单中: " + name);
        }
        return device;
    }

    public boolean contains(String name) {
        return devices.containsKey(name);
    }

    /**
     * 按给定名称取子集，保持清单中的顺序；未知名称被忽略
     */
    public List<Device> subset(Collection<String> names) {
        List<Device> result = new ArrayList<>();
        for (Device device : devices.values()) {
            if (names.contains(device.getName())) {
                result.add(device);
            }
        }
        return result;
    }

    public int size() {
        return devices.size();
    }

    public boolean isEmpty() {
        return devices.isEmpty();
    }

    @Override
    public String toString() {
        return "Inventory" + devices.keySet();
    }
}
