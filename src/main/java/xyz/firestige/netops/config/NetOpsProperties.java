package xyz.firestige.netops.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 全局配置（通过 application 配置覆盖默认值）
 * <pre>
 * netops:
 *   max-concurrency: 10        # 每个阶段同时在途的设备动作上限
 *   action-timeout: 30s        # 单次设备动作尝试的上限
 *   connectivity-check: false  # 是否在下发前增加连通性预检阶段
 *   retry:
 *     strategy: fixed          # fixed 或 exponential
 *     max-attempts: 3
 *     delay: 2s
 *     multiplier: 2.0          # 仅 exponential
 *     max-delay: 30s           # 仅 exponential
 *   backup:
 *     store-type: memory       # memory 或 filesystem
 *     directory: backups
 *     write-index: true
 *   report:
 *     directory:               # 为空时不写 JSON 报告
 * </pre>
 */
@ConfigurationProperties(prefix = "netops")
public class NetOpsProperties {

    private int maxConcurrency = 10;
    private Duration actionTimeout = Duration.ofSeconds(30);
    private boolean connectivityCheck = false;
    private final Retry retry = new Retry();
    private final Backup backup = new Backup();
    private final Report report = new Report();

    public int getMaxConcurrency() { return maxConcurrency; }
    public void setMaxConcurrency(int maxConcurrency) { this.maxConcurrency = maxConcurrency; }

    public Duration getActionTimeout() { return actionTimeout; }
    public void setActionTimeout(Duration actionTimeout) { this.actionTimeout = actionTimeout; }

    public boolean isConnectivityCheck() { return connectivityCheck; }
    public void setConnectivityCheck(boolean connectivityCheck) { this.connectivityCheck = connectivityCheck; }

    public Retry getRetry() { return retry; }

    public Backup getBackup() { return backup; }

    public Report getReport() { return report; }

    public enum RetryPolicy {
        FIXED,
        EXPONENTIAL
    }

    public enum StoreType {
        MEMORY,
        FILESYSTEM
    }

    public static class Retry {
        private RetryPolicy strategy = RetryPolicy.FIXED;
        private int maxAttempts = 3;
        private Duration delay = Duration.ofSeconds(2);
        private double multiplier = 2.0;
        private Duration maxDelay = Duration.ofSeconds(30);

        public RetryPolicy getStrategy() { return strategy; }
        public void setStrategy(RetryPolicy strategy) { this.strategy = strategy; }

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

        public Duration getDelay() { return delay; }
        public void setDelay(Duration delay) { this.delay = delay; }

        public double getMultiplier() { return multiplier; }
        public void setMultiplier(double multiplier) { this.multiplier = multiplier; }

        public Duration getMaxDelay() { return maxDelay; }
        public void setMaxDelay(Duration maxDelay) { this.maxDelay = maxDelay; }
    }

    public static class Backup {
        private StoreType storeType = StoreType.MEMORY;
        private String directory = "backups";
        private boolean writeIndex = true;

        public StoreType getStoreType() { return storeType; }
        public void setStoreType(StoreType storeType) { this.storeType = storeType; }

        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }

        public boolean isWriteIndex() { return writeIndex; }
        public void setWriteIndex(boolean writeIndex) { this.writeIndex = writeIndex; }
    }

    public static class Report {
        private String directory;

        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }
    }
}
