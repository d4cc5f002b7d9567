package xyz.firestige.netops.validation.validator;

import java.util.HashSet;
import java.util.Set;

import xyz.firestige.netops.domain.device.Device;
import xyz.firestige.netops.domain.intent.ConfigIntent;
import xyz.firestige.netops.validation.IntentValidator;
import xyz.firestige.netops.validation.ValidationError;
import xyz.firestige.netops.validation.ValidationInput;
import xyz.firestige.netops.validation.ValidationResult;
import xyz.firestige.netops.validation.ValidationWarning;

/**
 * 设备引用校验器
 * <p>
 * 目标配置引用的设备必须存在于清单中，且每台设备只能有一份目标配置。
 * 清单中没有目标配置的设备只产生警告。
 */
public class DeviceReferenceValidator implements IntentValidator {

    public static final String DEVICE_NOT_FOUND = "DEVICE_NOT_FOUND";
    public static final String DUPLICATE_INTENT = "DUPLICATE_INTENT";

    @Override
    public ValidationResult validate(ValidationInput input) {
        ValidationResult result = new ValidationResult();
        Set<String> seen = new HashSet<>();

        for (ConfigIntent intent : input.intents().all()) {
            String deviceName = intent.getDeviceName();
            if (!input.inventory().contains(deviceName)) {
                result.addError(ValidationError.of(deviceName, "device", DEVICE_NOT_FOUND,
                        "设备不在清单中: " + deviceName, deviceName));
            }
            if (!seen.add(deviceName)) {
                result.addError(ValidationError.of(deviceName, "device", DUPLICATE_INTENT,
                        "同一设备存在多份目标配置: " + deviceName, deviceName));
            }
        }

        for (Device device : input.inventory().devices()) {
            if (!seen.contains(device.getName())) {
                result.addWarning(new ValidationWarning(device.getName(), "设备没有目标配置，只参与备份"));
            }
        }

        return result;
    }

    @Override
    public String getValidatorName() {
        return "DeviceReferenceValidator";
    }

    @Override
    public int getOrder() {
        return 10;
    }
}
