package xyz.firestige.netops.domain.intent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 单台设备的目标配置：阶段 → 有序指令列表
 * <p>
 * 由外部配置加载产生，加载后只读。
 */
public final class ConfigIntent {

    private final String deviceName;
    private final Map<Stage, List<Directive>> directives;

    private ConfigIntent(String deviceName, Map<Stage, List<Directive>> directives) {
        this.deviceName = deviceName;
        this.directives = Collections.unmodifiableMap(directives);
    }

    public static Builder forDevice(String deviceName) {
        return new Builder(deviceName);
    }

    public String getDeviceName() {
        return deviceName;
    }

    /**
     * 某阶段的指令切片，没有时返回空列表
     */
    public List<Directive> directives(Stage stage) {
        return directives.getOrDefault(stage, List.of());
    }

    public Map<Stage, List<Directive>> getDirectives() {
        return directives;
    }

    public boolean hasStage(Stage stage) {
        return !directives(stage).isEmpty();
    }

    @Override
    public String toString() {
        return "ConfigIntent{" + deviceName + ", stages=" + directives.keySet() + '}';
    }

    public static final class Builder {
        private final String deviceName;
        private final Map<Stage, List<Directive>> directives = new EnumMap<>(Stage.class);

        private Builder(String deviceName) {
            this.deviceName = deviceName;
        }

        public Builder add(Directive directive) {
            directives.computeIfAbsent(directive.stage(), s -> new ArrayList<>()).add(directive);
            return this;
        }

        public Builder addAll(List<? extends Directive> list) {
            list.forEach(this::add);
            return this;
        }

        public ConfigIntent build() {
            Map<Stage, List<Directive>> copy = new EnumMap<>(Stage.class);
            directives.forEach((stage, list) -> copy.put(stage, List.copyOf(list)));
            return new ConfigIntent(deviceName, copy);
        }
    }
}
