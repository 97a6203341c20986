package com.lore.agentic.service.answer;

import com.lore.agentic.model.AnswerResult;
import com.lore.agentic.model.ContextDocument;
import com.lore.agentic.model.SourceRef;
import com.lore.agentic.service.PromptTemplateService;
import com.lore.agentic.service.llm.ChatCompletionClient;
import com.lore.agentic.service.retrieval.HybridRetrievalService;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 回答生成：检索上下文文档，拼入回答模板交给模型，最后附上来源列表
 */
@Service
public class AnswerGenerationService {

    private static final Logger logger = LoggerFactory.getLogger(AnswerGenerationService.class);

    static final String PROMPT_TEMPLATE = "answer.txt";
    static final String UNTITLED = "Untitled";
    static final String NO_ANSWER = "Could not get an answer.";
    static final String SOURCES_HEADER = "\n\nSources:\n";

    private final HybridRetrievalService retrievalService;
    private final ChatCompletionClient chatClient;
    private final PromptTemplateService promptTemplateService;
    private final int maxLength;

    public AnswerGenerationService(HybridRetrievalService retrievalService,
                                   ChatCompletionClient chatClient,
                                   PromptTemplateService promptTemplateService,
                                   @Value("${answer.max-length:4000}") int maxLength) {
        this.retrievalService = retrievalService;
        this.chatClient = chatClient;
        this.promptTemplateService = promptTemplateService;
        this.maxLength = maxLength;
    }

    public AnswerResult answer(String question) {
        logger.info("💬 开始生成回答: {}", question);
        return answer(question, retrievalService.retrieve(question));
    }

    /**
     * 上下文为空时仍然调用模型，由模板约束模型回答"不知道"
     */
    AnswerResult answer(String question, List<ContextDocument> documents) {
        Map<String, String> variables = new HashMap<>();
        variables.put("max_length", String.valueOf(maxLength));
        variables.put("context", stuffDocuments(documents));
        variables.put("question", question);

        String raw = chatClient.completeText(promptTemplateService.render(PROMPT_TEMPLATE, variables));
        String answer = StringUtils.isBlank(raw) ? NO_ANSWER : raw.trim();

        List<SourceRef> sources = collectSources(documents);
        logger.info("✅ 回答生成完成: 上下文文档{}个, 来源{}个", documents.size(), sources.size());
        return new AnswerResult(answer, sources, answer + formatSources(sources));
    }

    static String stuffDocuments(List<ContextDocument> documents) {
        List<String> parts = new ArrayList<>();
        for (ContextDocument document : documents) {
            if (StringUtils.isNotBlank(document.getContent())) {
                parts.add(document.getContent());
            }
        }
        return String.join("\n\n", parts);
    }

    /**
     * 标题取 document_title，其次 title，再次文档自身标题；没有链接的文档不计入来源
     */
    static List<SourceRef> collectSources(List<ContextDocument> documents) {
        Set<SourceRef> unique = new LinkedHashSet<>();
        for (ContextDocument document : documents) {
            Map<String, Object> metadata = document.getMetadata() != null
                ? document.getMetadata() : Collections.<String, Object>emptyMap();
            String source = asText(metadata.get("source"));
            if (StringUtils.isBlank(source)) {
                continue;
            }
            String title = asText(metadata.get("document_title"));
            if (StringUtils.isBlank(title)) {
                title = asText(metadata.get("title"));
            }
            if (StringUtils.isBlank(title)) {
                title = StringUtils.defaultIfBlank(document.getTitle(), UNTITLED);
            }
            unique.add(new SourceRef(title, source));
        }
        return new ArrayList<>(unique);
    }

    static String formatSources(List<SourceRef> sources) {
        if (sources.isEmpty()) {
            return "";
        }
        StringBuilder text = new StringBuilder(SOURCES_HEADER);
        for (int i = 0; i < sources.size(); i++) {
            if (i > 0) {
                text.append("\n");
            }
            SourceRef ref = sources.get(i);
            text.append(i + 1).append(". [").append(ref.getTitle()).append("](").append(ref.getSource()).append(")");
        }
        return text.toString();
    }

    private static String asText(Object value) {
        return value != null ? value.toString() : null;
    }
}
