package com.lore.agentic.service.tools;

import com.lore.agentic.model.ToolDefinition;

import java.util.Map;

/**
 * 工具接口（推理引擎可调用的所有工具都要实现此接口）
 */
public interface Tool {

    /**
     * 获取工具定义（描述、参数等，供模型理解）
     */
    ToolDefinition getDefinition();

    /**
     * 执行工具
     *
     * @param args 参数
     * @return 需要作用到工作集上的动作
     */
    PayloadAction execute(Map<String, Object> args) throws Exception;

    /**
     * 工具名称
     */
    String getName();
}
