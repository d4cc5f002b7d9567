package xyz.firestige.netops.validation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import xyz.firestige.netops.domain.device.Inventory;
import xyz.firestige.netops.domain.intent.IntentSet;

/**
 * 预检校验服务
 * <p>
 * 在任何设备被触碰之前执行。只要有一条违规，整个运行就不会开始；
 * 不存在"部分通过"。
 */
public class IntentValidationService {

    private static final Logger log = LoggerFactory.getLogger(IntentValidationService.class);

    private final ValidationChain chain;

    public IntentValidationService(ValidationChain chain) {
        this.chain = chain;
    }

    public ValidationResult validate(Inventory inventory, IntentSet intents) {
        ValidationResult result = chain.validate(new ValidationInput(inventory, intents));
        result.getWarnings().forEach(w -> log.warn("校验警告: device={}, {}", w.getDeviceName(), w.getMessage()));
        if (result.isValid()) {
            log.info("配置校验通过, devices: {}, intents: {}", inventory.size(), intents.size());
        } else {
            log.error("配置校验未通过, 违规 {} 处, 涉及设备: {}", result.getErrors().size(), result.getInvalidDevices());
            result.getErrors().forEach(e -> log.error("校验失败: device={}, field={}, code={}, {}",
                    e.getDeviceName(), e.getField(), e.getErrorCode(), e.getMessage()));
        }
        return result;
    }

    /**
     * 校验失败时抛出 {@link ValidationException}
     */
    public void validateOrThrow(Inventory inventory, IntentSet intents) {
        ValidationResult result = validate(inventory, intents);
        if (!result.isValid()) {
            throw new ValidationException(result.getErrors());
        }
    }

    public ValidationChain getChain() {
        return chain;
    }
}
