package com.lore.agentic.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 推理引擎的一次决策：要么请求若干工具调用，要么终止
 */
@Getter
public class EngineDecision {

    private final List<ToolCall> toolCalls;

    /**
     * 模型返回的文字内容（可能为空）
     */
    private final String content;

    private EngineDecision(List<ToolCall> toolCalls, String content) {
        this.toolCalls = Collections.unmodifiableList(new ArrayList<>(toolCalls));
        this.content = content;
    }

    public static EngineDecision toolCalls(List<ToolCall> calls, String content) {
        return new EngineDecision(calls, content);
    }

    public static EngineDecision terminal(String content) {
        return new EngineDecision(Collections.emptyList(), content);
    }

    public boolean isTerminal() {
        return toolCalls.isEmpty();
    }

    public ChatMessage toAssistantMessage() {
        return ChatMessage.assistant(content, toolCalls);
    }
}
