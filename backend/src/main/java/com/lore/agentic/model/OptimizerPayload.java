package com.lore.agentic.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 优化器的可变工作集
 *
 * 只属于一次优化运行，不支持并发修改。
 */
public class OptimizerPayload {

    private final List<PayloadNode> nodes;
    private final Map<NodePair, PathRecord> paths;

    public OptimizerPayload(List<PayloadNode> nodes, Map<NodePair, PathRecord> paths) {
        this.nodes = new ArrayList<>(nodes);
        this.paths = new LinkedHashMap<>(paths);
    }

    public List<PayloadNode> getNodes() {
        return nodes;
    }

    public Map<NodePair, PathRecord> getPaths() {
        return paths;
    }

    public int size() {
        return nodes.size();
    }

    public boolean containsTitle(String title) {
        for (PayloadNode node : nodes) {
            if (title.equals(node.getTitle())) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return 实际删除的节点数
     */
    public int removeByIds(Collection<String> ids) {
        Set<String> targets = new HashSet<>(ids);
        int before = nodes.size();
        nodes.removeIf(node -> targets.contains(node.getId()));
        return before - nodes.size();
    }

    /**
     * 标题已存在的节点不会重复加入
     *
     * @return 实际新增的节点数
     */
    public int addAbsent(Collection<PayloadNode> candidates) {
        int added = 0;
        for (PayloadNode candidate : candidates) {
            String title = candidate.getTitle();
            if (title != null && !containsTitle(title)) {
                nodes.add(candidate);
                added++;
            }
        }
        return added;
    }
}
