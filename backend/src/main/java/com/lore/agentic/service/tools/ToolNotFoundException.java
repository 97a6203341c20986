package com.lore.agentic.service.tools;

/**
 * 推理引擎请求了未注册的工具
 */
public class ToolNotFoundException extends RuntimeException {

    private final String toolName;

    public ToolNotFoundException(String toolName) {
        super("工具不存在: " + toolName);
        this.toolName = toolName;
    }

    public String getToolName() {
        return toolName;
    }
}
