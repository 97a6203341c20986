package com.lore.agentic.service.graph;

import com.lore.agentic.model.GraphNodeInfo;
import com.lore.agentic.model.PathRecord;

import java.util.Optional;
import java.util.Set;

/**
 * 图数据库查询接口
 *
 * 提供Neo4j和内存两种实现，运行时根据配置选择。所有方法对图谱只读。
 */
public interface GraphStore {

    /**
     * 查询节点信息
     *
     * @param title 节点标题
     * @param detailed 是否包含出入边（不含记账类关系）
     * @return 节点不存在时为空
     */
    Optional<GraphNodeInfo> getNodeInfo(String title, boolean detailed);

    /**
     * 查询两节点间长度不超过 maxHops 的最短路径
     *
     * @param excludedRelationTypes 路径上任何边都不能是这些类型
     * @param excludedInteriorLabels 中间节点（不含两端）不能携带这些标签
     * @param excludedTitles 中间节点不能是这些标题
     * @return 没有满足条件的路径时为空
     */
    Optional<PathRecord> shortestPath(String titleA,
                                      String titleB,
                                      int maxHops,
                                      Set<String> excludedRelationTypes,
                                      Set<String> excludedInteriorLabels,
                                      Set<String> excludedTitles);

    /**
     * 通过指定关系类型（大小写不敏感、不区分方向）查找一个相邻节点
     *
     * @return 相邻节点标题
     */
    Optional<String> neighborByRelation(String title, String relationType);
}
