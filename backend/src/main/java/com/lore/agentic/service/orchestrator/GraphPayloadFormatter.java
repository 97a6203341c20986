package com.lore.agentic.service.orchestrator;

import com.lore.agentic.model.GraphNodeInfo;
import com.lore.agentic.model.OptimizerPayload;
import com.lore.agentic.model.PayloadNode;
import com.lore.agentic.model.RelationRef;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 把优化器工作集序列化成推理引擎可读的文本
 */
@Component
public class GraphPayloadFormatter {

    static final String EMPTY_GRAPH = "The graph is currently empty.";

    public String format(OptimizerPayload payload) {
        List<PayloadNode> nodes = payload.getNodes();
        if (nodes.isEmpty()) {
            return EMPTY_GRAPH;
        }

        List<String> blocks = new ArrayList<>(nodes.size());
        for (PayloadNode node : nodes) {
            blocks.add(formatNode(node));
        }
        return "\n\n" + String.join("\n---\n", blocks);
    }

    String formatNode(PayloadNode node) {
        GraphNodeInfo info = node.getInfo() != null ? node.getInfo() : GraphNodeInfo.titleOnly(null);

        List<String> relations = new ArrayList<>();
        for (RelationRef out : info.getOutgoing()) {
            relations.add("RELATION: " + out.getType() + " -> TARGET: " + out.getTitle());
        }
        for (RelationRef in : info.getIncoming()) {
            relations.add("RELATION: " + in.getType() + " <- SOURCE: " + in.getTitle());
        }

        StringBuilder block = new StringBuilder();
        block.append("=== NODE: ").append(info.getTitle()).append(" (ID: ").append(node.getId()).append(") ===\n");
        block.append("DESCRIPTION: ").append(info.getDescription() != null ? info.getDescription() : "");
        if (!relations.isEmpty()) {
            block.append("\nAVAILABLE RELATIONS:");
            for (String relation : relations) {
                block.append('\n').append(relation);
            }
        }
        return block.toString();
    }
}
