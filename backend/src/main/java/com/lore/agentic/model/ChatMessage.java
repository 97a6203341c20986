package com.lore.agentic.model;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 对话消息
 */
@Data
@Builder
public class ChatMessage {

    public static final String ROLE_SYSTEM = "system";
    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_TOOL = "tool";

    private String role;

    private String content;

    /**
     * assistant 消息携带的工具调用
     */
    @Builder.Default
    private List<ToolCall> toolCalls = new ArrayList<>();

    /**
     * tool 消息对应的调用 id
     */
    private String toolCallId;

    public static ChatMessage system(String content) {
        return ChatMessage.builder().role(ROLE_SYSTEM).content(content).build();
    }

    public static ChatMessage user(String content) {
        return ChatMessage.builder().role(ROLE_USER).content(content).build();
    }

    public static ChatMessage assistant(String content, List<ToolCall> toolCalls) {
        return ChatMessage.builder()
            .role(ROLE_ASSISTANT)
            .content(content)
            .toolCalls(toolCalls != null ? new ArrayList<>(toolCalls) : new ArrayList<>())
            .build();
    }

    public static ChatMessage tool(String toolCallId, String content) {
        return ChatMessage.builder().role(ROLE_TOOL).toolCallId(toolCallId).content(content).build();
    }
}
