package com.lore.agentic.service.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lore.agentic.model.ChatMessage;
import com.lore.agentic.model.ToolCall;
import com.lore.agentic.model.ToolDefinition;
import com.lore.config.LlmClientConfig;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * OpenAI 兼容的 chat/completions 客户端（非流式）
 */
@Service
public class ChatCompletionClient {

    private static final Logger logger = LoggerFactory.getLogger(ChatCompletionClient.class);

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final LlmClientConfig config;

    public ChatCompletionClient(@Qualifier("llmRestTemplate") RestTemplate restTemplate,
                                ObjectMapper objectMapper,
                                LlmClientConfig config) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.config = config;
    }

    /**
     * 发送对话，返回原始响应
     */
    public JsonNode complete(List<ChatMessage> messages, List<ToolDefinition> tools) {
        Map<String, Object> requestBody = new LinkedHashMap<>();
        requestBody.put("model", config.getModel());
        requestBody.put("temperature", config.getTemperature());
        requestBody.put("messages", toWireMessages(messages));
        if (tools != null && !tools.isEmpty()) {
            requestBody.put("tools", toWireTools(tools));
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (StringUtils.isNotBlank(config.getApiKey())) {
            headers.setBearerAuth(config.getApiKey());
        }

        String url = config.getChatUrl();
        logger.debug("🌐 调用大模型接口: {} (messages={}, tools={})", url, messages.size(), tools != null ? tools.size() : 0);
        try {
            JsonNode response = restTemplate.postForObject(url, new HttpEntity<>(requestBody, headers), JsonNode.class);
            if (response == null) {
                throw new ReasoningEngineException("大模型返回空响应");
            }
            return response;
        } catch (RestClientException e) {
            throw new ReasoningEngineException("大模型调用失败: " + e.getMessage(), e);
        }
    }

    /**
     * 单轮提问，返回文本内容；没有内容时返回空串
     */
    public String completeText(String prompt) {
        JsonNode response = complete(Collections.singletonList(ChatMessage.user(prompt)), Collections.emptyList());
        JsonNode content = response.path("choices").path(0).path("message").path("content");
        return content.isTextual() ? content.asText() : "";
    }

    private List<Map<String, Object>> toWireMessages(List<ChatMessage> messages) {
        List<Map<String, Object>> wire = new ArrayList<>();
        for (ChatMessage message : messages) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("role", message.getRole());
            item.put("content", message.getContent() != null ? message.getContent() : "");
            if (message.getToolCalls() != null && !message.getToolCalls().isEmpty()) {
                List<Map<String, Object>> calls = new ArrayList<>();
                for (ToolCall call : message.getToolCalls()) {
                    Map<String, Object> function = new HashMap<>();
                    function.put("name", call.getName());
                    function.put("arguments", writeArguments(call.getArguments()));

                    Map<String, Object> wireCall = new LinkedHashMap<>();
                    wireCall.put("id", call.getId());
                    wireCall.put("type", "function");
                    wireCall.put("function", function);
                    calls.add(wireCall);
                }
                item.put("tool_calls", calls);
            }
            if (message.getToolCallId() != null) {
                item.put("tool_call_id", message.getToolCallId());
            }
            wire.add(item);
        }
        return wire;
    }

    private List<Map<String, Object>> toWireTools(List<ToolDefinition> tools) {
        List<Map<String, Object>> wire = new ArrayList<>();
        for (ToolDefinition tool : tools) {
            Map<String, Object> function = new LinkedHashMap<>();
            function.put("name", tool.getName());
            function.put("description", tool.getDescription());
            function.put("parameters", tool.getParameters());

            Map<String, Object> item = new LinkedHashMap<>();
            item.put("type", "function");
            item.put("function", function);
            wire.add(item);
        }
        return wire;
    }

    private String writeArguments(Map<String, Object> arguments) {
        try {
            return objectMapper.writeValueAsString(arguments != null ? arguments : Collections.emptyMap());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("工具参数序列化失败", e);
        }
    }
}
