package com.lore.agentic.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 优化器工作集中的节点
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PayloadNode {

    private String id;

    private double score;

    private GraphNodeInfo info;

    public String getTitle() {
        return info != null ? info.getTitle() : null;
    }

    /**
     * 扩展得到的新节点以标题生成 id
     */
    public static String idForTitle(String title) {
        return "node_" + title.replace(' ', '_');
    }
}
