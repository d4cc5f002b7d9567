package xyz.firestige.netops.validation.validator;

import java.util.List;

import xyz.firestige.netops.domain.intent.ConfigIntent;
import xyz.firestige.netops.domain.intent.Directive;
import xyz.firestige.netops.domain.intent.InterfaceDirective;
import xyz.firestige.netops.domain.intent.NetworkStatement;
import xyz.firestige.netops.domain.intent.RoutingDirective;
import xyz.firestige.netops.domain.intent.Stage;
import xyz.firestige.netops.domain.intent.VlanDirective;
import xyz.firestige.netops.validation.IntentValidator;
import xyz.firestige.netops.validation.ValidationError;
import xyz.firestige.netops.validation.ValidationInput;
import xyz.firestige.netops.validation.ValidationResult;

/**
 * 地址格式校验器
 * <p>
 * 只检查已填写的值，缺失字段由 {@link RequiredFieldValidator} 报告。
 */
public class AddressFormatValidator implements IntentValidator {

    public static final String MALFORMED_ADDRESS = "MALFORMED_ADDRESS";

    @Override
    public ValidationResult validate(ValidationInput input) {
        ValidationResult result = new ValidationResult();
        for (ConfigIntent intent : input.intents().all()) {
            for (Stage stage : Stage.values()) {
                List<Directive> directives = intent.directives(stage);
                for (int i = 0; i < directives.size(); i++) {
                    check(intent.getDeviceName(), stage.getPhaseName() + "[" + i + "]", directives.get(i), result);
                }
            }
        }
        return result;
    }

    private void check(String device, String prefix, Directive directive, ValidationResult result) {
        if (directive instanceof InterfaceDirective) {
            InterfaceDirective d = (InterfaceDirective) directive;
            address(device, prefix + ".address", d.address(), result);
            mask(device, prefix + ".mask", d.mask(), result);
        } else if (directive instanceof VlanDirective) {
            VlanDirective d = (VlanDirective) directive;
            address(device, prefix + ".address", d.address(), result);
            mask(device, prefix + ".mask", d.mask(), result);
        } else if (directive instanceof RoutingDirective) {
            RoutingDirective d = (RoutingDirective) directive;
            address(device, prefix + ".routerId", d.routerId(), result);
            for (int i = 0; i < d.networks().size(); i++) {
                NetworkStatement n = d.networks().get(i);
                String field = prefix + ".networks[" + i + "]";
                address(device, field + ".network", n.network(), result);
                if (present(n.wildcard()) && !Ipv4.isWildcard(n.wildcard())) {
                    result.addError(ValidationError.of(device, field + ".wildcard", MALFORMED_ADDRESS,
                            "反掩码格式不正确: " + n.wildcard(), n.wildcard()));
                }
            }
        }
    }

    private void address(String device, String field, String value, ValidationResult result) {
        if (present(value) && !Ipv4.isAddress(value)) {
            result.addError(ValidationError.of(device, field, MALFORMED_ADDRESS,
                    "IP 地址格式不正确: " + value, value));
        }
    }

    private void mask(String device, String field, String value, ValidationResult result) {
        if (present(value) && !Ipv4.isMask(value)) {
            result.addError(ValidationError.of(device, field, MALFORMED_ADDRESS,
                    "子网掩码格式不正确: " + value, value));
        }
    }

    private boolean present(String value) {
        return value != null && !value.isBlank();
    }

    @Override
    public String getValidatorName() {
        return "AddressFormatValidator";
    }

    @Override
    public int getOrder() {
        return 30;
    }
}
