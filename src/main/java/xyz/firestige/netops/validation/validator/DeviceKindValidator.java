package xyz.firestige.netops.validation.validator;

import xyz.firestige.netops.domain.device.Device;
import xyz.firestige.netops.driver.DeviceDriverRegistry;
import xyz.firestige.netops.validation.IntentValidator;
import xyz.firestige.netops.validation.ValidationError;
import xyz.firestige.netops.validation.ValidationInput;
import xyz.firestige.netops.validation.ValidationResult;

/**
 * 设备身份校验器：地址不能为空，设备类型必须有已注册的驱动
 */
public class DeviceKindValidator implements IntentValidator {

    public static final String MISSING_ADDRESS = "MISSING_ADDRESS";
    public static final String UNSUPPORTED_KIND = "UNSUPPORTED_KIND";

    private final DeviceDriverRegistry driverRegistry;

    public DeviceKindValidator(DeviceDriverRegistry driverRegistry) {
        this.driverRegistry = driverRegistry;
    }

    @Override
    public ValidationResult validate(ValidationInput input) {
        ValidationResult result = new ValidationResult();
        for (Device device : input.inventory().devices()) {
            if (device.getAddress() == null || device.getAddress().isBlank()) {
                result.addError(ValidationError.of(device.getName(), "address", MISSING_ADDRESS,
                        "设备地址不能为空"));
            }
            if (!driverRegistry.supports(device.getKind())) {
                result.addError(ValidationError.of(device.getName(), "kind", UNSUPPORTED_KIND,
                        "没有可用驱动的设备类型: " + device.getKind(), device.getKind()));
            }
        }
        return result;
    }

    @Override
    public String getValidatorName() {
        return "DeviceKindValidator";
    }

    @Override
    public int getOrder() {
        return 15;
    }
}
