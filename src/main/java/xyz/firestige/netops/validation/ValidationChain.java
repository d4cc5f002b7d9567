package xyz.firestige.netops.validation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 校验链
 * 按 order 顺序执行多个校验器，违规按校验器顺序累积
 */
public class ValidationChain {

    private static final Logger log = LoggerFactory.getLogger(ValidationChain.class);

    private final List<IntentValidator> validators = new ArrayList<>();

    /**
     * 是否快速失败（遇到第一个出错的校验器就停止）
     */
    private final boolean failFast;

    public ValidationChain() {
        this(false);
    }

    public ValidationChain(boolean failFast) {
        this.failFast = failFast;
    }

    /**
     * 添加校验器
     */
    public ValidationChain addValidator(IntentValidator validator) {
        this.validators.add(validator);
        this.validators.sort(Comparator.comparingInt(IntentValidator::getOrder));
        return this;
    }

    /**
     * 添加多个校验器
     */
    public ValidationChain addValidators(List<? extends IntentValidator> validators) {
        this.validators.addAll(validators);
        this.validators.sort(Comparator.comparingInt(IntentValidator::getOrder));
        return this;
    }

    public ValidationResult validate(ValidationInput input) {
        ValidationResult result = new ValidationResult();

        for (IntentValidator validator : validators) {
            ValidationResult validatorResult = validator.validate(input);
            if (validatorResult.hasErrors()) {
                log.info("校验器 {} 发现 {} 处违规", validator.getValidatorName(), validatorResult.getErrors().size());
            }
            result.merge(validatorResult);

            if (failFast && !validatorResult.isValid()) {
                break;
            }
        }

        return result;
    }

    /**
     * 获取所有校验器名称
     */
    public List<String> getValidatorNames() {
        return validators.stream()
                .map(IntentValidator::getValidatorName)
                .collect(Collectors.toList());
    }

    public List<IntentValidator> getValidators() {
        return List.copyOf(validators);
    }

    public boolean isFailFast() {
        return failFast;
    }
}
