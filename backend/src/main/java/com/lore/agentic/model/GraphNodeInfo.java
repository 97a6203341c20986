package com.lore.agentic.model;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 图谱节点信息（只读视图，节点本身归外部图数据库所有）
 */
@Data
@Builder(toBuilder = true)
public class GraphNodeInfo {

    /**
     * 节点标题（唯一键）
     */
    private String title;

    @Builder.Default
    private List<String> labels = new ArrayList<>();

    /**
     * 节点描述（首段文字）
     */
    private String description;

    /**
     * 原文链接
     */
    private String source;

    /**
     * 出边（仅详细模式）
     */
    @Builder.Default
    private List<RelationRef> outgoing = new ArrayList<>();

    /**
     * 入边（仅详细模式）
     */
    @Builder.Default
    private List<RelationRef> incoming = new ArrayList<>();

    public static GraphNodeInfo titleOnly(String title) {
        return GraphNodeInfo.builder().title(title).build();
    }
}
