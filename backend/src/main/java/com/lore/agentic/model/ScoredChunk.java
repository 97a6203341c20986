package com.lore.agentic.model;

import lombok.Builder;
import lombok.Data;

import java.util.HashMap;
import java.util.Map;

/**
 * 向量检索命中的文本块
 */
@Data
@Builder
public class ScoredChunk {

    /**
     * 所属文档标题，对应图谱节点标题
     */
    private String title;

    private String content;

    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();

    /**
     * 相似度距离（越小越相近）
     */
    private double score;

    public String sourceUrl() {
        Object source = metadata.get("source");
        if (source == null) {
            source = metadata.get("url");
        }
        return source != null ? source.toString() : null;
    }
}
