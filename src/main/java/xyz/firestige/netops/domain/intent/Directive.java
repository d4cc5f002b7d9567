package xyz.firestige.netops.domain.intent;

/**
 * 声明式配置指令：某个阶段内的一条目标状态
 */
public interface Directive {

    Stage stage();

    /**
     * 用于日志与校验报告的简短标识
     */
    String describe();
}
