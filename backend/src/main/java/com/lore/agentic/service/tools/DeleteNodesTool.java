package com.lore.agentic.service.tools;

import com.lore.agentic.model.ToolDefinition;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 删除节点工具
 *
 * 上下文瘦身：删除与当前问题无关的节点。
 */
@Component
public class DeleteNodesTool implements Tool {

    public static final String NAME = "delete_nodes";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public ToolDefinition getDefinition() {
        Map<String, Object> itemProp = new HashMap<>();
        itemProp.put("type", "string");

        Map<String, Object> idsProp = new HashMap<>();
        idsProp.put("type", "array");
        idsProp.put("items", itemProp);
        idsProp.put("description", "IDs of the nodes to delete, as shown in the node header (ID: node_N)");

        Map<String, Object> properties = new HashMap<>();
        properties.put("node_ids", idsProp);

        Map<String, Object> params = new HashMap<>();
        params.put("type", "object");
        params.put("properties", properties);
        params.put("required", new String[]{"node_ids"});

        return ToolDefinition.builder()
            .name(getName())
            .description("Context optimization: removes nodes that do not help answer the current question. "
                + "Use it to clear side branches of the graph that are unrelated to the question.")
            .parameters(params)
            .build();
    }

    @Override
    public PayloadAction execute(Map<String, Object> args) {
        return PayloadAction.deleteNodes(readIds(args.get("node_ids")));
    }

    static List<String> readIds(Object raw) {
        List<String> ids = new ArrayList<>();
        if (raw instanceof Collection) {
            for (Object item : (Collection<?>) raw) {
                if (item != null) {
                    ids.add(item.toString().trim());
                }
            }
        } else if (raw instanceof String) {
            for (String part : ((String) raw).split(",")) {
                if (!part.trim().isEmpty()) {
                    ids.add(part.trim());
                }
            }
        } else if (raw != null) {
            throw new IllegalArgumentException("node_ids 必须是字符串数组");
        }
        return ids;
    }
}
