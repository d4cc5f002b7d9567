package xyz.firestige.netops.execution;

import java.util.List;

import xyz.firestige.netops.domain.device.Device;
import xyz.firestige.netops.domain.intent.Directive;

/**
 * 设备动作：阶段内对单台设备执行的工作
 * <p>
 * 抛出的任何异常都会在 {@link PhaseExecutor} 边界转换为 Failed 结果，
 * 不会影响同阶段的其他设备。
 */
@FunctionalInterface
public interface DeviceAction {

    /**
     * @param device     目标设备
     * @param directives 该设备在本阶段的指令切片（可能为空）
     * @param context    运行上下文
     * @return 结果说明，记录到 DeviceOutcome 的 detail
     */
    String apply(Device device, List<Directive> directives, RunContext context) throws Exception;
}
