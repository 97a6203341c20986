package com.lore.agentic.service.tools;

import com.lore.agentic.model.ToolDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 工具注册表（管理所有可用工具）
 */
@Service
public class ToolRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<String, Tool> tools = Collections.synchronizedMap(new LinkedHashMap<>());

    public ToolRegistry(List<Tool> tools) {
        for (Tool tool : tools) {
            register(tool);
        }
    }

    /**
     * 注册工具
     */
    public void register(Tool tool) {
        tools.put(tool.getName(), tool);
        logger.info("📌 工具已注册: {}", tool.getName());
    }

    /**
     * 获取工具
     *
     * @throws ToolNotFoundException 工具未注册
     */
    public Tool getTool(String name) {
        Tool tool = tools.get(name);
        if (tool == null) {
            throw new ToolNotFoundException(name);
        }
        return tool;
    }

    /**
     * 获取所有工具定义（供模型选择）
     */
    public List<ToolDefinition> getAllDefinitions() {
        synchronized (tools) {
            List<ToolDefinition> definitions = new ArrayList<>();
            for (Tool tool : tools.values()) {
                definitions.add(tool.getDefinition());
            }
            return definitions;
        }
    }

    /**
     * 执行工具
     */
    public PayloadAction executeTool(String toolName, Map<String, Object> args) throws Exception {
        Tool tool = getTool(toolName);
        logger.info("🔧 执行工具: {} | 参数: {}", toolName, args);
        PayloadAction action = tool.execute(args);
        logger.info("✅ 工具执行完成: {}", toolName);
        return action;
    }

    public Set<String> getAllToolNames() {
        synchronized (tools) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(tools.keySet()));
        }
    }
}
