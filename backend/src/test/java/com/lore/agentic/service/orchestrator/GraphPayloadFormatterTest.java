package com.lore.agentic.service.orchestrator;

import com.lore.agentic.model.GraphNodeInfo;
import com.lore.agentic.model.OptimizerPayload;
import com.lore.agentic.model.PayloadNode;
import com.lore.agentic.model.RelationRef;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class GraphPayloadFormatterTest {

    private final GraphPayloadFormatter formatter = new GraphPayloadFormatter();

    @Test
    void emptyPayloadHasPlaceholderText() {
        OptimizerPayload empty = new OptimizerPayload(Collections.emptyList(), Collections.emptyMap());

        assertEquals(GraphPayloadFormatter.EMPTY_GRAPH, formatter.format(empty));
    }

    @Test
    void nodesListDescriptionAndRelations() {
        GraphNodeInfo horus = GraphNodeInfo.builder()
            .title("Horus")
            .description("Warmaster")
            .outgoing(Arrays.asList(new RelationRef("LEADS", "Sons of Horus")))
            .incoming(Arrays.asList(new RelationRef("BETRAYED", "Emperor")))
            .build();
        OptimizerPayload payload = new OptimizerPayload(Arrays.asList(
            new PayloadNode("node_1", 1.0, horus),
            new PayloadNode("node_2", 0.0, GraphNodeInfo.titleOnly("Terra"))), Collections.emptyMap());

        String text = formatter.format(payload);

        assertEquals("\n\n=== NODE: Horus (ID: node_1) ===\n"
            + "DESCRIPTION: Warmaster\n"
            + "AVAILABLE RELATIONS:\n"
            + "RELATION: LEADS -> TARGET: Sons of Horus\n"
            + "RELATION: BETRAYED <- SOURCE: Emperor\n"
            + "---\n"
            + "=== NODE: Terra (ID: node_2) ===\n"
            + "DESCRIPTION: ", text);
    }
}
