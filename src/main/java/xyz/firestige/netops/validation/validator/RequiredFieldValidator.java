package xyz.firestige.netops.validation.validator;

import java.util.List;

import xyz.firestige.netops.domain.intent.ConfigIntent;
import xyz.firestige.netops.domain.intent.Directive;
import xyz.firestige.netops.domain.intent.InterfaceDirective;
import xyz.firestige.netops.domain.intent.NetworkStatement;
import xyz.firestige.netops.domain.intent.RoutingDirective;
import xyz.firestige.netops.domain.intent.RoutingProtocol;
import xyz.firestige.netops.domain.intent.Stage;
import xyz.firestige.netops.domain.intent.VlanDirective;
import xyz.firestige.netops.validation.IntentValidator;
import xyz.firestige.netops.validation.ValidationError;
import xyz.firestige.netops.validation.ValidationInput;
import xyz.firestige.netops.validation.ValidationResult;

/**
 * 必填字段校验器
 */
public class RequiredFieldValidator implements IntentValidator {

    public static final String MISSING_FIELD = "MISSING_FIELD";
    public static final String INVALID_VALUE = "INVALID_VALUE";

    @Override
    public ValidationResult validate(ValidationInput input) {
        ValidationResult result = new ValidationResult();
        for (ConfigIntent intent : input.intents().all()) {
            for (Stage stage : Stage.values()) {
                List<Directive> directives = intent.directives(stage);
                for (int i = 0; i < directives.size(); i++) {
                    String prefix = stage.getPhaseName() + "[" + i + "]";
                    check(intent.getDeviceName(), prefix, directives.get(i), result);
                }
            }
        }
        return result;
    }

    private void check(String device, String prefix, Directive directive, ValidationResult result) {
        if (directive instanceof InterfaceDirective) {
            InterfaceDirective d = (InterfaceDirective) directive;
            require(device, prefix + ".name", d.name(), result);
            require(device, prefix + ".address", d.address(), result);
            require(device, prefix + ".mask", d.mask(), result);
        } else if (directive instanceof RoutingDirective) {
            checkRouting(device, prefix, (RoutingDirective) directive, result);
        } else if (directive instanceof VlanDirective) {
            VlanDirective d = (VlanDirective) directive;
            require(device, prefix + ".vlanId", d.vlanId(), result);
            require(device, prefix + ".subinterface", d.subinterface(), result);
            require(device, prefix + ".address", d.address(), result);
            require(device, prefix + ".mask", d.mask(), result);
            if (d.vlanId() != null && (d.vlanId() < 1 || d.vlanId() > 4094)) {
                result.addError(ValidationError.of(device, prefix + ".vlanId", INVALID_VALUE,
                        "VLAN id 超出范围 1-4094", d.vlanId()));
            }
        }
    }

    private void checkRouting(String device, String prefix, RoutingDirective d, ValidationResult result) {
        require(device, prefix + ".protocol", d.protocol(), result);
        require(device, prefix + ".processId", d.processId(), result);
        if (d.processId() != null && d.processId() <= 0) {
            result.addError(ValidationError.of(device, prefix + ".processId", INVALID_VALUE,
                    "进程号/AS 号必须为正数", d.processId()));
        }
        if (d.networks().isEmpty()) {
            result.addError(ValidationError.of(device, prefix + ".networks", MISSING_FIELD,
                    "至少需要宣告一个网段"));
        }
        for (int i = 0; i < d.networks().size(); i++) {
            NetworkStatement n = d.networks().get(i);
            String field = prefix + ".networks[" + i + "]";
            require(device, field + ".network", n.network(), result);
            require(device, field + ".wildcard", n.wildcard(), result);
            if (d.protocol() == RoutingProtocol.OSPF) {
                require(device, field + ".area", n.area(), result);
            }
        }
    }

    private void require(String device, String field, Object value, ValidationResult result) {
        boolean missing = value == null || (value instanceof String && ((String) value).isBlank());
        if (missing) {
            result.addError(ValidationError.of(device, field, MISSING_FIELD, "缺少必填字段: " + field));
        }
    }

    @Override
    public String getValidatorName() {
        return "RequiredFieldValidator";
    }

    @Override
    public int getOrder() {
        return 20;
    }
}
