package com.lore.agentic.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 图相关性打分配置
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "graph.relevance")
public class GraphRelevanceProperties {

    /**
     * 最短路径的最大跳数
     */
    private int maxHops = 5;

    /**
     * 两两查询的并发线程数
     */
    private int poolSize = 8;

    /**
     * 单个节点对查询的超时（毫秒）
     */
    private long queryTimeoutMs = 10000;

    /**
     * 路径上不允许出现的关系类型（结构性/记账类关系，与语义相关性无关）
     */
    private List<String> excludedRelationTypes = new ArrayList<>();

    /**
     * 中间节点不允许携带的"噪声"标签
     */
    private List<String> noiseLabels = new ArrayList<>();

    /**
     * 代表"未知"的占位节点标题，不允许作为中间节点
     */
    private List<String> placeholderTitles = new ArrayList<>();

    /**
     * 详细节点信息中不展示的关系类型
     */
    private List<String> bookkeepingRelationTypes = new ArrayList<>();

    public Set<String> excludedRelationTypeSet() {
        return new LinkedHashSet<>(excludedRelationTypes);
    }

    public Set<String> noiseLabelSet() {
        return new LinkedHashSet<>(noiseLabels);
    }

    public Set<String> placeholderTitleSet() {
        return new LinkedHashSet<>(placeholderTitles);
    }

    public Set<String> bookkeepingRelationTypeSet() {
        return new LinkedHashSet<>(bookkeepingRelationTypes);
    }
}
