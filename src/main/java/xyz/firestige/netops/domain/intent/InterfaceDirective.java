package xyz.firestige.netops.domain.intent;

/**
 * 接口地址配置
 *
 * @param enabled 为 null 时视为启用（no shutdown）
 */
public record InterfaceDirective(String name, String address, String mask, String description, Boolean enabled)
        implements Directive {

    public boolean isEnabled() {
        return enabled == null || enabled;
    }

    @Override
    public Stage stage() {
        return Stage.INTERFACES;
    }

    @Override
    public String describe() {
        return "interface " + name;
    }
}
