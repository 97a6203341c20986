package com.lore.agentic.service.orchestrator;

/**
 * 上下文优化循环的状态
 */
public enum OptimizerState {
    /** 把当前节点集交给推理引擎决策 */
    DECIDE,
    /** 执行引擎请求的工具调用 */
    EXECUTE,
    DONE
}
