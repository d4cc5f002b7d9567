package xyz.firestige.netops.testutil;

import java.util.Map;

import org.junit.jupiter.api.extension.AfterTestExecutionCallback;
import org.junit.jupiter.api.extension.BeforeTestExecutionCallback;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.api.extension.ExtensionContext.Namespace;
import org.junit.jupiter.api.extension.ExtensionContext.Store;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * 测试耗时与 MDC 残留监控
 * <p>
 * 设备都是模拟的，单个测试正常在毫秒级；超过阈值记一条警告。
 * 测试线程上残留的 runId/phase/device 也会记录并清掉，避免串到下一个测试的日志里。
 */
public class TimingExtension implements BeforeTestExecutionCallback, AfterTestExecutionCallback {

    private static final Logger logger = LoggerFactory.getLogger(TimingExtension.class);
    private static final String START_NANOS = "startNanos";
    private static final long SLOW_TEST_THRESHOLD_MS = 5_000;

    @Override
    public void beforeTestExecution(ExtensionContext context) {
        getStore(context).put(START_NANOS, System.nanoTime());
    }

    @Override
    public void afterTestExecution(ExtensionContext context) {
        long elapsedMs = (System.nanoTime() - getStore(context).remove(START_NANOS, long.class)) / 1_000_000;
        if (elapsedMs > SLOW_TEST_THRESHOLD_MS) {
            logger.warn("慢测试: {} 耗时 {}ms", context.getDisplayName(), elapsedMs);
        }

        Map<String, String> leaked = MDC.getCopyOfContextMap();
        if (leaked != null && !leaked.isEmpty()) {
            logger.warn("测试线程残留 MDC: {} -> {}", context.getDisplayName(), leaked);
            MDC.clear();
        }
    }

    private Store getStore(ExtensionContext context) {
        return context.getStore(Namespace.create(getClass(), context.getRequiredTestMethod()));
    }
}
