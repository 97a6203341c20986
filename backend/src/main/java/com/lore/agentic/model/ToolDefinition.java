package com.lore.agentic.model;

import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * 工具定义（供推理引擎选择调用）
 */
@Data
@Builder
public class ToolDefinition {

    /**
     * 工具名称
     */
    private String name;

    /**
     * 工具描述（告诉模型这个工具的用途）
     */
    private String description;

    /**
     * 参数schema（JSON Schema格式）
     */
    private Map<String, Object> parameters;
}
