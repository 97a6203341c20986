package com.lore.agentic.service.retrieval;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lore.agentic.model.QueryDecomposition;
import com.lore.agentic.service.PromptTemplateService;
import com.lore.agentic.service.llm.ChatCompletionClient;
import com.lore.agentic.service.llm.ReasoningEngineException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class QueryDecompositionServiceTest {

    private ChatCompletionClient client;
    private QueryDecompositionService service;

    @BeforeEach
    void setUp() {
        client = mock(ChatCompletionClient.class);
        service = new QueryDecompositionService(client,
            new PromptTemplateService(new DefaultResourceLoader()), new ObjectMapper());
    }

    @Test
    void parsesFencedJsonAndTrimsValues() {
        when(client.completeText(contains("Where did Abaddon fight Guilliman?"))).thenReturn(
            "```json\n{\"entities\": [\" Abaddon \", \"\", \"Guilliman\"],"
                + " \"questions\": [{\"text\": \" Where did Abaddon fight? \"}, {\"text\": \"Where did Guilliman fight?\"}]}\n```");

        QueryDecomposition result = service.decompose("Where did Abaddon fight Guilliman?");

        assertEquals(Arrays.asList("Abaddon", "Guilliman"), result.getEntities());
        assertEquals(Arrays.asList("Where did Abaddon fight?", "Where did Guilliman fight?"), result.getQuestions());
    }

    @Test
    void acceptsPlainStringQuestions() {
        QueryDecomposition result = service.parse("{\"entities\":[],\"questions\":[\"Who is Horus?\"]}");

        assertEquals(Arrays.asList("Who is Horus?"), result.getQuestions());
    }

    @Test
    void malformedOutputDegradesToEmpty() {
        when(client.completeText(anyString())).thenReturn("I cannot help with that");
        assertTrue(service.decompose("Who is Horus?").isEmpty());

        assertTrue(service.parse("{\"entities\": [\"Horus\"").isEmpty());
        assertTrue(service.parse("[1, 2]").isEmpty());
    }

    @Test
    void engineFailureDegradesToEmpty() {
        when(client.completeText(anyString())).thenThrow(new ReasoningEngineException("timeout"));

        assertTrue(service.decompose("Who is Horus?").isEmpty());
    }
}
