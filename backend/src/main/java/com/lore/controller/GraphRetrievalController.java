package com.lore.controller;

import com.lore.agentic.config.GraphRelevanceProperties;
import com.lore.agentic.model.AnswerResult;
import com.lore.agentic.model.ContextDocument;
import com.lore.agentic.service.answer.AnswerGenerationService;
import com.lore.agentic.service.graph.GraphRelevanceScorer;
import com.lore.agentic.service.retrieval.HybridRetrievalService;
import com.lore.common.Result;
import com.lore.dto.AskRequest;
import com.lore.dto.RelevanceRequest;
import com.lore.dto.RelevanceResponse;
import com.lore.dto.RetrievalRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.validation.Valid;
import java.util.List;

/**
 * 图相关性打分、混合检索与问答
 */
@RestController
@RequestMapping("/api")
public class GraphRetrievalController {

    private static final Logger logger = LoggerFactory.getLogger(GraphRetrievalController.class);

    private final GraphRelevanceScorer relevanceScorer;
    private final HybridRetrievalService retrievalService;
    private final AnswerGenerationService answerService;
    private final GraphRelevanceProperties relevanceProperties;

    public GraphRetrievalController(GraphRelevanceScorer relevanceScorer,
                                    HybridRetrievalService retrievalService,
                                    AnswerGenerationService answerService,
                                    GraphRelevanceProperties relevanceProperties) {
        this.relevanceScorer = relevanceScorer;
        this.retrievalService = retrievalService;
        this.answerService = answerService;
        this.relevanceProperties = relevanceProperties;
    }

    @PostMapping("/graph/relevance")
    public Result<RelevanceResponse> relevance(@Valid @RequestBody RelevanceRequest request) {
        int maxHops = request.getMaxHops() != null ? request.getMaxHops() : relevanceProperties.getMaxHops();
        return Result.success(RelevanceResponse.from(relevanceScorer.score(request.getTitles(), maxHops)));
    }

    @PostMapping("/retrieval")
    public Result<List<ContextDocument>> retrieve(@Valid @RequestBody RetrievalRequest request) {
        logger.info("📥 检索请求: {}", request.getQuery());
        return Result.success(retrievalService.retrieve(request.getQuery()));
    }

    @PostMapping("/ask")
    public Result<AnswerResult> ask(@Valid @RequestBody AskRequest request) {
        logger.info("📥 问答请求: {}", request.getQuestion());
        return Result.success(answerService.answer(request.getQuestion()));
    }
}
