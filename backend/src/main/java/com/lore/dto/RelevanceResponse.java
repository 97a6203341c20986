package com.lore.dto;

import com.lore.agentic.model.GraphRelevanceResult;
import com.lore.agentic.model.NodePair;
import com.lore.agentic.model.PathRecord;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 图相关性结果的对外视图，路径键写作 "a|b"
 */
@Data
public class RelevanceResponse {

    private Map<String, Double> scores;

    private Map<String, List<String>> paths;

    private List<String> intermediateNodes;

    public static RelevanceResponse from(GraphRelevanceResult result) {
        RelevanceResponse response = new RelevanceResponse();
        response.setScores(new LinkedHashMap<>(result.getNodeScores()));

        Map<String, List<String>> paths = new LinkedHashMap<>();
        for (Map.Entry<NodePair, PathRecord> entry : result.getPaths().entrySet()) {
            paths.put(entry.getKey().getFrom() + "|" + entry.getKey().getTo(), entry.getValue().toSequence());
        }
        response.setPaths(paths);
        response.setIntermediateNodes(new ArrayList<>(result.getIntermediateNodes()));
        return response;
    }
}
