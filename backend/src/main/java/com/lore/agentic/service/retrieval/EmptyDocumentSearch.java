package com.lore.agentic.service.retrieval;

import com.lore.agentic.model.ScoredChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;

/**
 * 未接入向量库时的占位实现，始终返回空结果
 */
public class EmptyDocumentSearch implements DocumentSearchPort {

    private static final Logger logger = LoggerFactory.getLogger(EmptyDocumentSearch.class);

    public EmptyDocumentSearch() {
        logger.warn("⚠️ 未配置向量检索实现，检索将只返回空结果");
    }

    @Override
    public List<ScoredChunk> similaritySearch(String query, int k) {
        return Collections.emptyList();
    }
}
