package xyz.firestige.netops.validation.validator;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import xyz.firestige.netops.domain.intent.ConfigIntent;
import xyz.firestige.netops.domain.intent.Directive;
import xyz.firestige.netops.domain.intent.Stage;
import xyz.firestige.netops.domain.intent.VlanDirective;
import xyz.firestige.netops.validation.IntentValidator;
import xyz.firestige.netops.validation.ValidationError;
import xyz.firestige.netops.validation.ValidationInput;
import xyz.firestige.netops.validation.ValidationResult;

/**
 * 同一设备上 VLAN id 与子接口不能重复
 */
public class DuplicateVlanValidator implements IntentValidator {

    public static final String DUPLICATE_VLAN = "DUPLICATE_VLAN";
    public static final String DUPLICATE_SUBINTERFACE = "DUPLICATE_SUBINTERFACE";

    @Override
    public ValidationResult validate(ValidationInput input) {
        ValidationResult result = new ValidationResult();
        for (ConfigIntent intent : input.intents().all()) {
            Set<Integer> vlanIds = new HashSet<>();
            Set<String> subinterfaces = new HashSet<>();
            List<Directive> directives = intent.directives(Stage.VLANS);
            for (int i = 0; i < directives.size(); i++) {
                VlanDirective d = (VlanDirective) directives.get(i);
                String prefix = "vlans[" + i + "]";
                if (d.vlanId() != null && !vlanIds.add(d.vlanId())) {
                    result.addError(ValidationError.of(intent.getDeviceName(), prefix + ".vlanId", DUPLICATE_VLAN,
                            "VLAN id 重复: " + d.vlanId(), d.vlanId()));
                }
                if (d.subinterface() != null && !subinterfaces.add(d.subinterface())) {
                    result.addError(ValidationError.of(intent.getDeviceName(), prefix + ".subinterface",
                            DUPLICATE_SUBINTERFACE, "子接口重复: " + d.subinterface(), d.subinterface()));
                }
            }
        }
        return result;
    }

    @Override
    public String getValidatorName() {
        return "DuplicateVlanValidator";
    }

    @Override
    public int getOrder() {
        return 40;
    }
}
