package xyz.firestige.netops.metrics;

/**
 * 指标名称常量
 */
public final class MetricNames {

    public static final String DEVICE_SUCCEEDED = "netops_device_succeeded";
    public static final String DEVICE_FAILED = "netops_device_failed";
    public static final String DEVICE_SKIPPED = "netops_device_skipped";
    public static final String DEVICE_RETRY = "netops_device_retry";
    public static final String BACKUP_CAPTURED = "netops_backup_captured";
    public static final String BACKUP_FAILED = "netops_backup_failed";
    public static final String PHASE_RUNNING = "netops_phase_running";

    private MetricNames() {
    }
}
