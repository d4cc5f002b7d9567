package xyz.firestige.netops.domain.intent;

/**
 * 配置阶段
 */
public enum Stage {

    INTERFACES("interfaces"),

    ROUTING("routing"),

    VLANS("vlans");

    private final String phaseName;

    Stage(String phaseName) {
        this.phaseName = phaseName;
    }

    /**
     * 该阶段在阶段图中的默认名称
     */
    public String getPhaseName() {
        return phaseName;
    }
}
