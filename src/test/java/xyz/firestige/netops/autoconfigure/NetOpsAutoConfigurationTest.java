package xyz.firestige.netops.autoconfigure;

import java.nio.file.Path;
import java.time.Duration;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import xyz.firestige.netops.application.ConfigurationRunService;
import xyz.firestige.netops.backup.BackupStore;
import xyz.firestige.netops.config.NetOpsProperties;
import xyz.firestige.netops.domain.backup.BackupRepository;
import xyz.firestige.netops.execution.PhaseExecutor;
import xyz.firestige.netops.execution.retry.ExponentialBackoffRetryStrategy;
import xyz.firestige.netops.execution.retry.FixedDelayRetryStrategy;
import xyz.firestige.netops.execution.retry.RetryStrategy;
import xyz.firestige.netops.infrastructure.config.FleetConfigLoader;
import xyz.firestige.netops.infrastructure.persistence.backup.FileSystemBackupRepository;
import xyz.firestige.netops.infrastructure.persistence.backup.InMemoryBackupRepository;
import xyz.firestige.netops.metrics.MetricsRegistry;
import xyz.firestige.netops.metrics.MicrometerMetricsRegistry;
import xyz.firestige.netops.metrics.NoopMetricsRegistry;
import xyz.firestige.netops.orchestration.Orchestrator;
import xyz.firestige.netops.session.DeviceSessionFactory;
import xyz.firestige.netops.testutil.TestFleet;
import xyz.firestige.netops.validation.IntentValidator;
import xyz.firestige.netops.validation.ValidationChain;
import xyz.firestige.netops.validation.ValidationInput;
import xyz.firestige.netops.validation.ValidationResult;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 编排引擎自动配置测试
 */
class NetOpsAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(NetOpsAutoConfiguration.class));

    @TempDir
    Path tempDir;

    @Test
    void withoutSessionFactory_onlyCoreBeansCreated() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(Orchestrator.class);
            assertThat(context).hasSingleBean(PhaseExecutor.class);
            assertThat(context).hasSingleBean(ValidationChain.class);
            assertThat(context).hasSingleBean(FleetConfigLoader.class);
            assertThat(context).doesNotHaveBean(BackupStore.class);
            assertThat(context).doesNotHaveBean(ConfigurationRunService.class);
            assertThat(context.getBean(MetricsRegistry.class)).isInstanceOf(NoopMetricsRegistry.class);
        });
    }

    @Test
    void withSessionFactory_runServiceCreated() {
        contextRunner
            .withBean(DeviceSessionFactory.class, TestFleet::sessions)
            .run(context -> {
                assertThat(context).hasSingleBean(BackupStore.class);
                assertThat(context).hasSingleBean(ConfigurationRunService.class);
                // 默认使用内存备份存储
                assertThat(context.getBean(BackupRepository.class)).isInstanceOf(InMemoryBackupRepository.class);
            });
    }

    @Test
    void properties_defaultValues_loaded() {
        contextRunner.run(context -> {
            NetOpsProperties properties = context.getBean(NetOpsProperties.class);
            assertThat(properties.getMaxConcurrency()).isEqualTo(10);
            assertThat(properties.getActionTimeout()).isEqualTo(Duration.ofSeconds(30));
            assertThat(properties.isConnectivityCheck()).isFalse();
            assertThat(properties.getRetry().getMaxAttempts()).isEqualTo(3);
            assertThat(properties.getBackup().getStoreType()).isEqualTo(NetOpsProperties.StoreType.MEMORY);
            assertThat(context.getBean(RetryStrategy.class)).isInstanceOf(FixedDelayRetryStrategy.class);
        });
    }

    @Test
    void properties_customValues_loaded() {
        contextRunner
            .withPropertyValues(
                "netops.max-concurrency=4",
                "netops.action-timeout=10s",
                "netops.retry.strategy=exponential",
                "netops.retry.max-attempts=5",
                "netops.retry.delay=500ms"
            )
            .run(context -> {
                assertThat(context.getBean(PhaseExecutor.class).getDefaultConcurrency()).isEqualTo(4);
                RetryStrategy strategy = context.getBean(RetryStrategy.class);
                assertThat(strategy).isInstanceOf(ExponentialBackoffRetryStrategy.class);
                assertThat(((ExponentialBackoffRetryStrategy) strategy).getMaxAttempts()).isEqualTo(5);
                assertThat(strategy.nextDelay(1, null)).isEqualTo(Duration.ofMillis(500));
            });
    }

    @Test
    void fileSystemStore_whenConfigured() {
        contextRunner
            .withBean(DeviceSessionFactory.class, TestFleet::sessions)
            .withPropertyValues(
                "netops.backup.store-type=filesystem",
                "netops.backup.directory=" + tempDir.resolve("backups")
            )
            .run(context -> {
                BackupRepository repository = context.getBean(BackupRepository.class);
                assertThat(repository).isInstanceOf(FileSystemBackupRepository.class);
                assertThat(((FileSystemBackupRepository) repository).getDirectory())
                    .isEqualTo(tempDir.resolve("backups"));
            });
    }

    @Test
    void meterRegistry_present_usesMicrometer() {
        contextRunner
            .withBean(MeterRegistry.class, SimpleMeterRegistry::new)
            .run(context -> assertThat(context.getBean(MetricsRegistry.class))
                .isInstanceOf(MicrometerMetricsRegistry.class));
    }

    @Test
    void extraValidatorBean_appendedToChain() {
        contextRunner
            .withBean("siteNamingValidator", IntentValidator.class, () -> new IntentValidator() {
                @Override
                public ValidationResult validate(ValidationInput input) {
                    return new ValidationResult();
                }

                @Override
                public String getValidatorName() {
                    return "SiteNamingValidator";
                }

                @Override
                public int getOrder() {
                    return 100;
                }
            })
            .run(context -> assertThat(context.getBean(ValidationChain.class).getValidatorNames())
                .endsWith("SiteNamingValidator")
                .hasSize(6));
    }
}
