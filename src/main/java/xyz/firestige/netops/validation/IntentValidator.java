package xyz.firestige.netops.validation;

/**
 * 目标配置校验器接口
 * <p>
 * 纯函数：只读取输入，不访问设备，不产生副作用。
 */
public interface IntentValidator {

    /**
     * 校验配置
     *
     * @param input 设备清单与目标配置
     * @return 校验结果
     */
    ValidationResult validate(ValidationInput input);

    /**
     * 获取校验器名称
     */
    String getValidatorName();

    /**
     * 获取执行顺序
     * 数字越小优先级越高
     */
    default int getOrder() {
        return 100;
    }
}
