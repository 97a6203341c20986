package com.lore.agentic.model;

import lombok.Value;

/**
 * 有序节点对，用作路径表的键
 */
@Value
public class NodePair {

    String from;

    String to;

    @Override
    public String toString() {
        return from + " <-> " + to;
    }
}
