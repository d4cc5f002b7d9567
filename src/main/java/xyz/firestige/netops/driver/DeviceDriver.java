package xyz.firestige.netops.driver;

import java.util.List;
import java.util.Set;

import xyz.firestige.netops.domain.intent.Directive;
import xyz.firestige.netops.domain.intent.Stage;

/**
 * 设备驱动：把声明式指令翻译为某类设备的命令行
 * <p>
 * 每种设备类型一个实现，由 {@link DeviceDriverRegistry} 按设备的 kind 标签选择。
 */
public interface DeviceDriver {

    /**
     * 支持的设备类型标签
     */
    Set<String> supportedKinds();

    /**
     * 渲染单条指令为配置命令
     */
    List<String> render(Directive directive);

    /**
     * 阶段下发后用于核对结果的只读命令
     */
    List<String> verificationCommands(Stage stage);

    /**
     * 持久化运行配置的命令
     */
    String saveCommand();

    String runningConfigCommand();

    String versionCommand();

    String hostnameCommand();

    /**
     * 检查命令回显，设备拒绝时抛出 {@link xyz.firestige.netops.exception.CommandRejectedException}
     */
    void checkOutput(String command, String output);

    /**
     * 把快照正文转换为可重新下发的配置命令
     */
    List<String> restoreCommands(String snapshotContent);
}
