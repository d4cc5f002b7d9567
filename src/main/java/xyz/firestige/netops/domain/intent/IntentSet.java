package xyz.firestige.netops.domain.intent;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * 一次运行的全部目标配置
 * <p>
 * 保留加载顺序与重复项，重复与未知设备由校验器报告。
 */
public final class IntentSet {

    private final List<ConfigIntent> intents;

    private IntentSet(List<ConfigIntent> intents) {
        this.intents = List.copyOf(intents);
    }

    public static IntentSet of(Collection<ConfigIntent> intents) {
        return new IntentSet(List.copyOf(intents));
    }

    public static IntentSet of(ConfigIntent... intents) {
        return new IntentSet(List.of(intents));
    }

    public static IntentSet empty() {
        return new IntentSet(List.of());
    }

    public List<ConfigIntent> all() {
        return intents;
    }

    public Optional<ConfigIntent> find(String deviceName) {
        return intents.stream().filter(i -> i.getDeviceName().equals(deviceName)).findFirst();
    }

    /**
     * 取某设备某阶段的指令切片
     */
    public List<Directive> sliceFor(String deviceName, Stage stage) {
        return find(deviceName).map(i -> i.directives(stage)).orElse(List.of());
    }

    public int size() {
        return intents.size();
    }
}
