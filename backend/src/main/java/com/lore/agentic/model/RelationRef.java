package com.lore.agentic.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 节点的一条关系：关系类型 + 另一端节点标题
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RelationRef {

    private String type;

    /**
     * 出边为目标节点，入边为来源节点
     */
    private String title;
}
