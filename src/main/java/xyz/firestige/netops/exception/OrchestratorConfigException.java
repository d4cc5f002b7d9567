package xyz.firestige.netops.exception;

/**
 * 阶段图配置错误（环、未知前驱、重复阶段名），只在构建时抛出
 */
public class OrchestratorConfigException extends NetOpsException {

    public OrchestratorConfigException(String message) {
        super(ErrorType.ORCHESTRATOR_CONFIG_ERROR, message);
    }
}
