package com.lore.agentic.service.llm;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lore.agentic.model.ChatMessage;
import com.lore.agentic.model.EngineDecision;
import com.lore.agentic.model.ToolCall;
import com.lore.agentic.model.ToolDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 基于 OpenAI 兼容工具调用协议的推理引擎
 *
 * 响应带 tool_calls 即为工具调用决策，否则为终止。响应结构无法识别时按终止处理。
 */
@Service
public class OpenAiReasoningEngine implements ReasoningEngine {

    private static final Logger logger = LoggerFactory.getLogger(OpenAiReasoningEngine.class);

    private static final TypeReference<Map<String, Object>> ARGS_TYPE = new TypeReference<Map<String, Object>>() {
    };

    private final ChatCompletionClient client;
    private final ObjectMapper objectMapper;

    public OpenAiReasoningEngine(ChatCompletionClient client, ObjectMapper objectMapper) {
        this.client = client;
        this.objectMapper = objectMapper;
    }

    @Override
    public EngineDecision decide(String systemPrompt, List<ChatMessage> conversation, List<ToolDefinition> tools) {
        List<ChatMessage> messages = new ArrayList<>(conversation.size() + 1);
        messages.add(ChatMessage.system(systemPrompt));
        messages.addAll(conversation);
        return parseDecision(client.complete(messages, tools));
    }

    EngineDecision parseDecision(JsonNode response) {
        JsonNode message = response.path("choices").path(0).path("message");
        if (message.isMissingNode() || !message.isObject()) {
            logger.warn("⚠️ 无法解析模型响应，按终止处理: {}", abbreviate(response.toString()));
            return EngineDecision.terminal(null);
        }

        String content = message.path("content").isTextual() ? message.path("content").asText() : null;
        JsonNode rawCalls = message.path("tool_calls");
        if (!rawCalls.isArray() || rawCalls.size() == 0) {
            return EngineDecision.terminal(content);
        }

        List<ToolCall> calls = new ArrayList<>();
        int index = 0;
        for (JsonNode rawCall : rawCalls) {
            JsonNode function = rawCall.path("function");
            String name = function.path("name").asText("");
            String id = rawCall.path("id").asText("");
            if (id.isEmpty()) {
                id = "call_" + index;
            }
            calls.add(new ToolCall(id, name, parseArguments(name, function.path("arguments"))));
            index++;
        }
        return EngineDecision.toolCalls(calls, content);
    }

    private Map<String, Object> parseArguments(String toolName, JsonNode arguments) {
        try {
            if (arguments.isObject()) {
                return objectMapper.convertValue(arguments, ARGS_TYPE);
            }
            if (arguments.isTextual() && !arguments.asText().trim().isEmpty()) {
                Map<String, Object> parsed = objectMapper.readValue(arguments.asText(), ARGS_TYPE);
                return parsed != null ? parsed : new HashMap<>();
            }
        } catch (Exception e) {
            logger.warn("工具参数解析失败: {} -> {}", toolName, abbreviate(arguments.toString()));
        }
        return new HashMap<>(Collections.<String, Object>emptyMap());
    }

    private String abbreviate(String value) {
        return value.length() > 200 ? value.substring(0, 200) + "..." : value;
    }
}
