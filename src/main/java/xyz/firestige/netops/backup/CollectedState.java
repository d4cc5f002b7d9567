package xyz.firestige.netops.backup;

/**
 * 从设备拉取的原始状态：运行配置与版本行
 */
public record CollectedState(String runningConfig, String versionLine) {
}
