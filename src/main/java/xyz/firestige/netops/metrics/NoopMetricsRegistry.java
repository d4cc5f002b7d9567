package xyz.firestige.netops.metrics;

/**
 * 空实现：未接入 Micrometer 时使用
 */
public class NoopMetricsRegistry implements MetricsRegistry {

    @Override
    public void incrementCounter(String name) {
    }

    @Override
    public void setGauge(String name, double value) {
    }
}
