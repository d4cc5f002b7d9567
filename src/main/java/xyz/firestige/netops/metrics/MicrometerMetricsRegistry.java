package xyz.firestige.netops.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Micrometer 适配，所有指标带 {@code component=netops} 标签
 */
public class MicrometerMetricsRegistry implements MetricsRegistry {

    private static final Tags COMMON_TAGS = Tags.of("component", "netops");

    private final MeterRegistry registry;
    private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, GaugeValue> gauges = new ConcurrentHashMap<>();

    public MicrometerMetricsRegistry(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void incrementCounter(String name) {
        counters.computeIfAbsent(name, n -> Counter.builder(n)
                .tags(COMMON_TAGS)
                .description("网络编排计数: " + n)
                .register(registry)).increment();
    }

    @Override
    public void setGauge(String name, double value) {
        gauges.computeIfAbsent(name, n -> {
            GaugeValue holder = new GaugeValue();
            Gauge.builder(n, holder, GaugeValue::get)
                    .tags(COMMON_TAGS)
                    .strongReference(true)
                    .register(registry);
            return holder;
        }).set(value);
    }

    static final class GaugeValue {
        private volatile double value;

        double get() {
            return value;
        }

        void set(double value) {
            this.value = value;
        }
    }
}
