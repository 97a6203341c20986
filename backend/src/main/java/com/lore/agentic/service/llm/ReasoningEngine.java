package com.lore.agentic.service.llm;

import com.lore.agentic.model.ChatMessage;
import com.lore.agentic.model.EngineDecision;
import com.lore.agentic.model.ToolDefinition;

import java.util.List;

/**
 * 推理引擎：根据系统提示和对话历史决定调用哪些工具，或结束
 */
public interface ReasoningEngine {

    /**
     * @throws ReasoningEngineException 调用失败
     */
    EngineDecision decide(String systemPrompt, List<ChatMessage> conversation, List<ToolDefinition> tools);
}
