package com.lore.agentic.service.tools;

import com.lore.agentic.model.GraphNodeInfo;
import com.lore.agentic.model.PayloadNode;
import com.lore.agentic.model.ToolDefinition;
import com.lore.agentic.service.graph.GraphStore;
import com.lore.agentic.service.graph.NodeInfoService;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 沿关系扩展节点工具
 *
 * 通过指定关系类型找到一个相邻节点，取其详细信息加入工作集。
 */
@Component
public class ExpandNodesViaRelationTool implements Tool {

    private static final Logger logger = LoggerFactory.getLogger(ExpandNodesViaRelationTool.class);

    public static final String NAME = "expand_nodes_via_relation";
    public static final String STATUS_NOT_FOUND = "relation not found";

    private static final String STRIP_CHARS = "()[]'\"`«».,;: ";

    private final GraphStore graphStore;
    private final NodeInfoService nodeInfoService;

    public ExpandNodesViaRelationTool(GraphStore graphStore, NodeInfoService nodeInfoService) {
        this.graphStore = graphStore;
        this.nodeInfoService = nodeInfoService;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public ToolDefinition getDefinition() {
        Map<String, Object> titleProp = new HashMap<>();
        titleProp.put("type", "string");
        titleProp.put("description", "Title of the source node (from the === NODE: ... === header)");

        Map<String, Object> relationProp = new HashMap<>();
        relationProp.put("type", "string");
        relationProp.put("description", "Relation type taken from the AVAILABLE RELATIONS list of that node");

        Map<String, Object> properties = new HashMap<>();
        properties.put("source_node_title", titleProp);
        properties.put("relation_type", relationProp);

        Map<String, Object> params = new HashMap<>();
        params.put("type", "object");
        params.put("properties", properties);
        params.put("required", new String[]{"source_node_title", "relation_type"});

        return ToolDefinition.builder()
            .name(getName())
            .description("Fetches the node connected to the given node by the given relation type "
                + "and adds it to the context.")
            .parameters(params)
            .build();
    }

    @Override
    public PayloadAction execute(Map<String, Object> args) {
        String sourceTitle = StringUtils.trimToEmpty(asString(args.get("source_node_title")));
        String relationType = normalizeRelationType(asString(args.get("relation_type")));
        if (sourceTitle.isEmpty() || relationType.isEmpty()) {
            throw new IllegalArgumentException("source_node_title 和 relation_type 不能为空");
        }

        Optional<String> target = graphStore.neighborByRelation(sourceTitle, relationType);
        if (!target.isPresent()) {
            logger.info("未找到关系: {} -[{}]-", sourceTitle, relationType);
            return PayloadAction.notFound(STATUS_NOT_FOUND);
        }

        String targetTitle = target.get();
        GraphNodeInfo info = nodeInfoService.find(targetTitle, true)
            .orElseGet(() -> GraphNodeInfo.titleOnly(targetTitle));
        PayloadNode node = new PayloadNode(PayloadNode.idForTitle(info.getTitle()), 0.0, info);
        logger.info("沿关系扩展: {} -[{}]- {}", sourceTitle, relationType, targetTitle);
        return PayloadAction.addNodes(Collections.singletonList(node));
    }

    static String normalizeRelationType(String raw) {
        return StringUtils.defaultString(StringUtils.strip(raw, STRIP_CHARS)).toUpperCase(Locale.ROOT);
    }

    private static String asString(Object value) {
        return value != null ? value.toString() : null;
    }
}
