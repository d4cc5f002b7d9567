package xyz.firestige.netops.domain.intent;

/**
 * VLAN 子接口配置（单臂路由）
 */
public record VlanDirective(Integer vlanId, String subinterface, String address, String mask, String description)
        implements Directive {

    @Override
    public Stage stage() {
        return Stage.VLANS;
    }

    @Override
    public String describe() {
        return "vlan " + vlanId + " on " + subinterface;
    }
}
