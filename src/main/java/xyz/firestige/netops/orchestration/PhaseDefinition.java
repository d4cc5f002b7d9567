package xyz.firestige.netops.orchestration;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import xyz.firestige.netops.domain.intent.Stage;
import xyz.firestige.netops.execution.DeviceAction;

/**
 * 阶段定义：名称、前驱阶段、设备动作、参与设备、指令阶段、并发上限
 */
public final class PhaseDefinition {

    private final String name;
    private final Set<String> dependsOn;
    private final DeviceAction action;
    private final Set<String> deviceNames;
    private final Stage stage;
    private final int concurrency;

    private PhaseDefinition(Builder builder) {
        this.name = builder.name;
        this.dependsOn = Collections.unmodifiableSet(new LinkedHashSet<>(builder.dependsOn));
        this.action = builder.action;
        this.deviceNames = builder.deviceNames == null ? null : Collections.unmodifiableSet(new LinkedHashSet<>(builder.deviceNames));
        this.stage = builder.stage;
        this.concurrency = builder.concurrency;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public Set<String> getDependsOn() {
        return dependsOn;
    }

    public DeviceAction getAction() {
        return action;
    }

    /**
     * 参与设备名，null 表示清单中的全部设备
     */
    public Set<String> getDeviceNames() {
        return deviceNames;
    }

    /**
     * 设备动作接收的指令阶段，null 表示动作不需要指令切片
     */
    public Stage getStage() {
        return stage;
    }

    /**
     * 并发上限，0 表示使用执行器默认值
     */
    public int getConcurrency() {
        return concurrency;
    }

    @Override
    public String toString() {
        return "PhaseDefinition{" + name + " <- " + dependsOn + "}";
    }

    public static final class Builder {
        private final String name;
        private final Set<String> dependsOn = new LinkedHashSet<>();
        private DeviceAction action;
        private Set<String> deviceNames;
        private Stage stage;
        private int concurrency;

        private Builder(String name) {
            this.name = name;
        }

        public Builder dependsOn(String... phases) {
            dependsOn.addAll(List.of(phases));
            return this;
        }

        public Builder action(DeviceAction action) {
            this.action = action;
            return this;
        }

        public Builder devices(Set<String> deviceNames) {
            this.deviceNames = deviceNames;
            return this;
        }

        public Builder stage(Stage stage) {
            this.stage = stage;
            return this;
        }

        public Builder concurrency(int concurrency) {
            this.concurrency = concurrency;
            return this;
        }

        public PhaseDefinition build() {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("阶段名不能为空");
            }
            Objects.requireNonNull(action, "action");
            if (concurrency < 0) {
                throw new IllegalArgumentException("concurrency 不能为负数: " + concurrency);
            }
            return new PhaseDefinition(this);
        }
    }
}
