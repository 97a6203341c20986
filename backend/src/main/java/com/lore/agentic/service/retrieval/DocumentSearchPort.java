package com.lore.agentic.service.retrieval;

import com.lore.agentic.model.ScoredChunk;

import java.util.List;

/**
 * 向量相似度检索（外部向量库）
 */
public interface DocumentSearchPort {

    /**
     * @param k 最多返回的文本块数
     */
    List<ScoredChunk> similaritySearch(String query, int k);
}
