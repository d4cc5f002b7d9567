package xyz.firestige.netops.validation;

import java.util.List;

import xyz.firestige.netops.exception.ErrorType;
import xyz.firestige.netops.exception.NetOpsException;

/**
 * 预检校验失败，整个运行在触碰任何设备之前中止
 */
public class ValidationException extends NetOpsException {

    private final List<ValidationError> errors;

    public ValidationException(List<ValidationError> errors) {
        super(ErrorType.VALIDATION_ERROR, "配置校验失败, 违规数: " + errors.size());
        if (errors.isEmpty()) {
            throw new IllegalArgumentException("ValidationException 需要至少一个错误");
        }
        this.errors = List.copyOf(errors);
    }

    public List<ValidationError> getErrors() {
        return errors;
    }
}
