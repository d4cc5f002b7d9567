package xyz.firestige.netops.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@Tag("fast")
@DisplayName("MicrometerMetricsRegistry 单元测试")
class MicrometerMetricsRegistryTest {

    @Test
    @DisplayName("场景: 计数器累加")
    void counterAccumulates() {
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        MetricsRegistry registry = new MicrometerMetricsRegistry(meterRegistry);

        registry.incrementCounter("netops.test.count");
        registry.incrementCounter("netops.test.count");

        assertThat(meterRegistry.get("netops.test.count").tag("component", "netops").counter().count())
                .isEqualTo(2.0);
    }

    @Test
    @DisplayName("场景: 同名 gauge 只注册一次，取最新值")
    void gaugeKeepsLatestValue() {
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        MetricsRegistry registry = new MicrometerMetricsRegistry(meterRegistry);

        registry.setGauge("netops.test.gauge", 3);
        registry.setGauge("netops.test.gauge", 7);

        assertThat(meterRegistry.find("netops.test.gauge").gauges()).hasSize(1);
        assertThat(meterRegistry.get("netops.test.gauge").gauge().value()).isEqualTo(7.0);
    }
}
