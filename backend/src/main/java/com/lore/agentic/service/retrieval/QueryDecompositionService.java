package com.lore.agentic.service.retrieval;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lore.agentic.model.QueryDecomposition;
import com.lore.agentic.service.PromptTemplateService;
import com.lore.agentic.service.llm.ChatCompletionClient;
import com.lore.agentic.service.llm.ReasoningEngineException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 问题拆解：子问题 + 实体（基本形式）
 *
 * 模型调用或解析失败时返回空结果，检索退化为纯相似度搜索。
 */
@Service
public class QueryDecompositionService {

    private static final Logger logger = LoggerFactory.getLogger(QueryDecompositionService.class);

    static final String PROMPT_TEMPLATE = "query-decomposition.txt";

    private final ChatCompletionClient chatClient;
    private final PromptTemplateService promptTemplateService;
    private final ObjectMapper objectMapper;

    public QueryDecompositionService(ChatCompletionClient chatClient,
                                     PromptTemplateService promptTemplateService,
                                     ObjectMapper objectMapper) {
        this.chatClient = chatClient;
        this.promptTemplateService = promptTemplateService;
        this.objectMapper = objectMapper;
    }

    public QueryDecomposition decompose(String question) {
        String prompt = promptTemplateService.render(PROMPT_TEMPLATE, Collections.singletonMap("question", question));

        String raw;
        try {
            raw = chatClient.completeText(prompt);
        } catch (ReasoningEngineException e) {
            logger.warn("问题拆解调用模型失败: {}", e.getMessage());
            return QueryDecomposition.empty();
        }

        QueryDecomposition result = parse(raw);
        logger.info("🧩 问题拆解: entities={}, questions={}", result.getEntities(), result.getQuestions());
        return result;
    }

    QueryDecomposition parse(String raw) {
        String json = extractJson(raw);
        if (json == null) {
            logger.warn("问题拆解结果不是 JSON: {}", StringUtils.abbreviate(raw, 200));
            return QueryDecomposition.empty();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (Exception e) {
            logger.warn("问题拆解 JSON 解析失败: {}", e.getMessage());
            return QueryDecomposition.empty();
        }
        if (root == null || !root.isObject()) {
            return QueryDecomposition.empty();
        }

        List<String> entities = new ArrayList<>();
        for (JsonNode entity : root.path("entities")) {
            String text = StringUtils.trimToEmpty(entity.asText(""));
            if (!text.isEmpty()) {
                entities.add(text);
            }
        }

        List<String> questions = new ArrayList<>();
        for (JsonNode question : root.path("questions")) {
            JsonNode textNode = question.isObject() ? question.path("text") : question;
            String text = StringUtils.trimToEmpty(textNode.asText(""));
            if (!text.isEmpty()) {
                questions.add(text);
            }
        }
        return new QueryDecomposition(entities, questions);
    }

    /**
     * 去掉 markdown 代码块，截取第一个 { 到最后一个 }
     */
    static String extractJson(String raw) {
        if (StringUtils.isBlank(raw)) {
            return null;
        }
        int start = raw.indexOf('{');
        int end = raw.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return null;
        }
        return raw.substring(start, end + 1);
    }
}
