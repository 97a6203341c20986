package com.lore.agentic.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 图相关性打分结果
 */
@Getter
@AllArgsConstructor
public class GraphRelevanceResult {

    /**
     * 节点标题 -> 累计得分（按输入顺序）
     */
    private final Map<String, Double> nodeScores;

    /**
     * 双向存储：(a,b) 与 (b,a) 各存一份，后者为前者的反转
     */
    private final Map<NodePair, PathRecord> paths;

    /**
     * 路径上出现、但不在候选集合中的中间节点
     */
    private final Set<String> intermediateNodes;

    public double scoreOf(String title) {
        Double score = nodeScores.get(title);
        return score != null ? score : 0.0;
    }

    public Optional<PathRecord> pathBetween(String a, String b) {
        return Optional.ofNullable(paths.get(new NodePair(a, b)));
    }
}
