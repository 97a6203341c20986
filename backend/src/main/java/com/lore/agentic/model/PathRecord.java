package com.lore.agentic.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 两节点间的一条路径：节点序列与关系类型序列交替排列
 *
 * [node0, rel0, node1, rel1, ..., nodeN]，关系数即路径长度。
 */
public final class PathRecord {

    private final List<String> nodes;
    private final List<String> relations;

    public PathRecord(List<String> nodes, List<String> relations) {
        if (nodes == null || nodes.isEmpty()) {
            throw new IllegalArgumentException("路径至少包含一个节点");
        }
        if (relations == null || relations.size() != nodes.size() - 1) {
            throw new IllegalArgumentException("关系数必须等于节点数减一");
        }
        this.nodes = Collections.unmodifiableList(new ArrayList<>(nodes));
        this.relations = Collections.unmodifiableList(new ArrayList<>(relations));
    }

    public List<String> getNodes() {
        return nodes;
    }

    public List<String> getRelations() {
        return relations;
    }

    public int length() {
        return relations.size();
    }

    public String first() {
        return nodes.get(0);
    }

    public String last() {
        return nodes.get(nodes.size() - 1);
    }

    /**
     * 去掉两端后的中间节点
     */
    public List<String> interiorNodes() {
        if (nodes.size() <= 2) {
            return Collections.emptyList();
        }
        return nodes.subList(1, nodes.size() - 1);
    }

    public PathRecord reverse() {
        List<String> reversedNodes = new ArrayList<>(nodes);
        List<String> reversedRelations = new ArrayList<>(relations);
        Collections.reverse(reversedNodes);
        Collections.reverse(reversedRelations);
        return new PathRecord(reversedNodes, reversedRelations);
    }

    public List<String> toSequence() {
        List<String> sequence = new ArrayList<>(nodes.size() + relations.size());
        for (int i = 0; i < relations.size(); i++) {
            sequence.add(nodes.get(i));
            sequence.add(relations.get(i));
        }
        sequence.add(last());
        return sequence;
    }

    /**
     * 渲染为 "A -[REL]- B -[REL2]- C"
     */
    public String render() {
        StringBuilder sb = new StringBuilder(first());
        for (int i = 0; i < relations.size(); i++) {
            sb.append(" -[").append(relations.get(i)).append("]- ").append(nodes.get(i + 1));
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PathRecord)) {
            return false;
        }
        PathRecord other = (PathRecord) o;
        return nodes.equals(other.nodes) && relations.equals(other.relations);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodes, relations);
    }

    @Override
    public String toString() {
        return render();
    }
}
