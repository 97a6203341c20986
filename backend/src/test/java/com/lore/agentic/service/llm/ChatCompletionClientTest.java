package com.lore.agentic.service.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lore.agentic.model.ChatMessage;
import com.lore.agentic.model.ToolCall;
import com.lore.agentic.service.tools.DeleteNodesTool;
import com.lore.config.LlmClientConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

public class ChatCompletionClientTest {

    private static final String URL = "http://llm.local/v1/chat/completions";

    private MockRestServiceServer server;
    private ChatCompletionClient client;

    @BeforeEach
    void setUp() {
        LlmClientConfig config = mock(LlmClientConfig.class);
        when(config.getChatUrl()).thenReturn(URL);
        when(config.getApiKey()).thenReturn("secret");
        when(config.getModel()).thenReturn("test-model");
        when(config.getTemperature()).thenReturn(0.12);

        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new ChatCompletionClient(restTemplate, new ObjectMapper(), config);
    }

    @Test
    void sendsMessagesToolsAndAuthorization() {
        server.expect(requestTo(URL))
            .andExpect(method(HttpMethod.POST))
            .andExpect(header("Authorization", "Bearer secret"))
            .andExpect(jsonPath("$.model").value("test-model"))
            .andExpect(jsonPath("$.messages[0].role").value("system"))
            .andExpect(jsonPath("$.messages[1].tool_calls[0].function.name").value("delete_nodes"))
            .andExpect(jsonPath("$.messages[1].tool_calls[0].function.arguments").value("{\"node_ids\":[\"node_2\"]}"))
            .andExpect(jsonPath("$.messages[2].tool_call_id").value("c1"))
            .andExpect(jsonPath("$.tools[0].type").value("function"))
            .andExpect(jsonPath("$.tools[0].function.name").value("delete_nodes"))
            .andRespond(withSuccess("{\"choices\":[{\"message\":{\"content\":\"ok\"}}]}", MediaType.APPLICATION_JSON));

        ToolCall call = new ToolCall("c1", "delete_nodes",
            Collections.<String, Object>singletonMap("node_ids", Collections.singletonList("node_2")));
        JsonNode response = client.complete(Arrays.asList(
            ChatMessage.system("sys"),
            ChatMessage.assistant(null, Collections.singletonList(call)),
            ChatMessage.tool("c1", "Removed nodes: 1")),
            Collections.singletonList(new DeleteNodesTool().getDefinition()));

        assertEquals("ok", response.path("choices").path(0).path("message").path("content").asText());
        server.verify();
    }

    @Test
    void completeTextReturnsContent() {
        server.expect(requestTo(URL))
            .andRespond(withSuccess("{\"choices\":[{\"message\":{\"content\":\"{}\"}}]}", MediaType.APPLICATION_JSON));

        assertEquals("{}", client.completeText("hello"));
    }

    @Test
    void httpErrorBecomesReasoningEngineException() {
        server.expect(requestTo(URL)).andRespond(withServerError());

        assertThrows(ReasoningEngineException.class, () -> client.completeText("hello"));
    }
}
