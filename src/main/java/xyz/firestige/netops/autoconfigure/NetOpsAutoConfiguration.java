package xyz.firestige.netops.autoconfigure;

import java.nio.file.Path;
import java.util.List;

import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;

import xyz.firestige.netops.application.ConfigurationRunService;
import xyz.firestige.netops.backup.BackupStore;
import xyz.firestige.netops.backup.DefaultBackupStore;
import xyz.firestige.netops.backup.StateCollector;
import xyz.firestige.netops.config.NetOpsProperties;
import xyz.firestige.netops.domain.backup.BackupRepository;
import xyz.firestige.netops.driver.CiscoIosDriver;
import xyz.firestige.netops.driver.DeviceDriver;
import xyz.firestige.netops.driver.DeviceDriverRegistry;
import xyz.firestige.netops.event.DomainEventPublisher;
import xyz.firestige.netops.event.SpringDomainEventPublisher;
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
import xyz.firestige.netops.report.RunReportAssembler;
import xyz.firestige.netops.report.RunReportWriter;
import xyz.firestige.netops.session.DeviceSessionFactory;
import xyz.firestige.netops.validation.IntentValidationService;
import xyz.firestige.netops.validation.IntentValidator;
import xyz.firestige.netops.validation.ValidationChain;
import xyz.firestige.netops.validation.validator.AddressFormatValidator;
import xyz.firestige.netops.validation.validator.DeviceKindValidator;
import xyz.firestige.netops.validation.validator.DeviceReferenceValidator;
import xyz.firestige.netops.validation.validator.DuplicateVlanValidator;
import xyz.firestige.netops.validation.validator.RequiredFieldValidator;

/**
 * 编排引擎自动配置
 * <p>
 * 所有 Bean 都带 {@code @ConditionalOnMissingBean}，调用方可以替换任意部分。
 * 设备传输（{@link DeviceSessionFactory}）不提供默认实现：
 * 容器中没有它时，备份与运行服务不会装配。
 */
@AutoConfiguration
@EnableConfigurationProperties(NetOpsProperties.class)
public class NetOpsAutoConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(NetOpsAutoConfiguration.class);

    // ========== Metrics & Events ==========

    @Bean
    @ConditionalOnMissingBean
    public MetricsRegistry netOpsMetricsRegistry(ObjectProvider<MeterRegistry> meterRegistry) {
        MeterRegistry registry = meterRegistry.getIfAvailable();
        if (registry == null) {
            logger.info("[AutoConfig] 未发现 MeterRegistry，使用 Noop 指标");
            return new NoopMetricsRegistry();
        }
        logger.info("[AutoConfig] 装配 Micrometer 指标");
        return new MicrometerMetricsRegistry(registry);
    }

    @Bean
    @ConditionalOnMissingBean
    public DomainEventPublisher netOpsDomainEventPublisher(ApplicationEventPublisher applicationEventPublisher) {
        return new SpringDomainEventPublisher(applicationEventPublisher);
    }

    // ========== Drivers & Validation ==========

    @Bean
    @ConditionalOnMissingBean
    public CiscoIosDriver ciscoIosDriver() {
        return new CiscoIosDriver();
    }

    @Bean
    @ConditionalOnMissingBean
    public DeviceDriverRegistry deviceDriverRegistry(List<DeviceDriver> drivers) {
        DeviceDriverRegistry registry = new DeviceDriverRegistry(drivers);
        logger.info("[AutoConfig] 已注册设备驱动: {}", registry.kinds());
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public ValidationChain intentValidationChain(DeviceDriverRegistry driverRegistry,
                                                 ObjectProvider<IntentValidator> extraValidators) {
        ValidationChain chain = new ValidationChain()
                .addValidator(new DeviceReferenceValidator())
                .addValidator(new DeviceKindValidator(driverRegistry))
                .addValidator(new RequiredFieldValidator())
                .addValidator(new AddressFormatValidator())
                .addValidator(new DuplicateVlanValidator());
        extraValidators.orderedStream().forEach(chain::addValidator);
        logger.info("[AutoConfig] 校验链: {}", chain.getValidatorNames());
        return chain;
    }

    @Bean
    @ConditionalOnMissingBean
    public IntentValidationService intentValidationService(ValidationChain chain) {
        return new IntentValidationService(chain);
    }

    // ========== Execution ==========

    @Bean
    @ConditionalOnMissingBean
    public RetryStrategy deviceRetryStrategy(NetOpsProperties properties) {
        NetOpsProperties.Retry retry = properties.getRetry();
        if (retry.getStrategy() == NetOpsProperties.RetryPolicy.EXPONENTIAL) {
            logger.info("[AutoConfig] 重试策略: 指数退避, maxAttempts={}, delay={}, multiplier={}, maxDelay={}",
                    retry.getMaxAttempts(), retry.getDelay(), retry.getMultiplier(), retry.getMaxDelay());
            return new ExponentialBackoffRetryStrategy(retry.getMaxAttempts(), retry.getDelay(),
                    retry.getMultiplier(), retry.getMaxDelay());
        }
        logger.info("[AutoConfig] 重试策略: 固定间隔, maxAttempts={}, delay={}", retry.getMaxAttempts(), retry.getDelay());
        return new FixedDelayRetryStrategy(retry.getMaxAttempts(), retry.getDelay());
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public PhaseExecutor phaseExecutor(NetOpsProperties properties, RetryStrategy retryStrategy) {
        return new PhaseExecutor(properties.getMaxConcurrency(), retryStrategy, properties.getActionTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public Orchestrator orchestrator(PhaseExecutor phaseExecutor) {
        return new Orchestrator(phaseExecutor);
    }

    // ========== Backup ==========

    @Bean
    @ConditionalOnMissingBean(BackupRepository.class)
    @ConditionalOnProperty(prefix = "netops.backup", name = "store-type", havingValue = "filesystem")
    public BackupRepository fileSystemBackupRepository(NetOpsProperties properties) {
        Path directory = Path.of(properties.getBackup().getDirectory());
        logger.info("[AutoConfig] 装配文件系统备份存储: {}", directory.toAbsolutePath());
        return new FileSystemBackupRepository(directory, properties.getBackup().isWriteIndex());
    }

    /**
     * 内存备份存储（Fallback）
     */
    @Bean
    @ConditionalOnMissingBean(BackupRepository.class)
    public BackupRepository inMemoryBackupRepository() {
        logger.warn("[AutoConfig] 装配 InMemory 备份存储（Fallback，进程退出后丢失）");
        return new InMemoryBackupRepository();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(DeviceSessionFactory.class)
    public StateCollector stateCollector(DeviceDriverRegistry driverRegistry, DeviceSessionFactory sessionFactory) {
        return new StateCollector(driverRegistry, sessionFactory);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(DeviceSessionFactory.class)
    public BackupStore backupStore(StateCollector stateCollector, BackupRepository backupRepository) {
        return new DefaultBackupStore(stateCollector, backupRepository);
    }

    // ========== Report & Application ==========

    @Bean
    @ConditionalOnMissingBean
    public RunReportAssembler runReportAssembler() {
        return new RunReportAssembler();
    }

    @Bean
    @ConditionalOnMissingBean
    public RunReportWriter runReportWriter() {
        return new RunReportWriter();
    }

    @Bean
    @ConditionalOnMissingBean
    public FleetConfigLoader fleetConfigLoader() {
        return new FleetConfigLoader();
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    @ConditionalOnBean(DeviceSessionFactory.class)
    public ConfigurationRunService configurationRunService(IntentValidationService validationService,
                                                           Orchestrator orchestrator,
                                                           DeviceDriverRegistry driverRegistry,
                                                           DeviceSessionFactory sessionFactory,
                                                           BackupStore backupStore,
                                                           RunReportAssembler reportAssembler,
                                                           RunReportWriter reportWriter,
                                                           MetricsRegistry metricsRegistry,
                                                           DomainEventPublisher eventPublisher,
                                                           NetOpsProperties properties) {
        String reportDir = properties.getReport().getDirectory();
        Path reportDirectory = reportDir == null || reportDir.isBlank() ? null : Path.of(reportDir);
        logger.info("[AutoConfig] 装配配置下发服务, maxConcurrency={}, actionTimeout={}, reportDirectory={}",
                properties.getMaxConcurrency(), properties.getActionTimeout(), reportDirectory);
        return new ConfigurationRunService(validationService, orchestrator, driverRegistry, sessionFactory,
                backupStore, reportAssembler, reportWriter, reportDirectory, metricsRegistry, eventPublisher,
                properties.isConnectivityCheck());
    }
}
