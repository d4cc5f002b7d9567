package xyz.firestige.netops.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 预检结果
 * <p>
 * 违规按加入顺序保存，合并时追加在末尾；校验链按 order 合并，最终顺序即校验器顺序。
 */
public class ValidationResult {

    private final List<ValidationError> errors = new ArrayList<>();
    private final List<ValidationWarning> warnings = new ArrayList<>();

    public void addError(ValidationError error) {
        errors.add(error);
    }

    public void addWarning(ValidationWarning warning) {
        warnings.add(warning);
    }

    public void merge(ValidationResult other) {
        if (other == null) {
            return;
        }
        errors.addAll(other.errors);
        warnings.addAll(other.warnings);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public List<ValidationError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public List<ValidationWarning> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    /**
     * 某台设备上的违规
     */
    public List<ValidationError> errorsFor(String deviceName) {
        return errors.stream()
                .filter(e -> deviceName.equals(e.getDeviceName()))
                .collect(Collectors.toList());
    }

    /**
     * 存在违规的设备，按首次出现的顺序；跨设备错误不计入
     */
    public Set<String> getInvalidDevices() {
        Set<String> devices = new LinkedHashSet<>();
        for (ValidationError error : errors) {
            if (error.getDeviceName() != null) {
                devices.add(error.getDeviceName());
            }
        }
        return Collections.unmodifiableSet(devices);
    }

    @Override
    public String toString() {
        return "ValidationResult{valid=" + isValid()
                + ", errors=" + errors.size()
                + ", warnings=" + warnings.size()
                + ", devices=" + getInvalidDevices() + '}';
    }
}
