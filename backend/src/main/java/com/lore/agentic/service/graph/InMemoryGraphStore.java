package com.lore.agentic.service.graph;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lore.agentic.config.GraphRelevanceProperties;
import com.lore.agentic.model.GraphNodeInfo;
import com.lore.agentic.model.PathRecord;
import com.lore.agentic.model.RelationRef;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 内存图数据库（降级方案）
 *
 * 未启用Neo4j时使用；可从 JSON 种子文件加载节点和关系。
 * 关系有方向，路径查询按无向图做广度优先搜索。
 */
@Service
@ConditionalOnProperty(name = "graph.neo4j.enabled", havingValue = "false", matchIfMissing = true)
public class InMemoryGraphStore implements GraphStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryGraphStore.class);

    private final Map<String, GraphNodeInfo> nodes = new ConcurrentHashMap<>();
    private final Map<String, List<Edge>> adjacency = new ConcurrentHashMap<>();
    private final Set<String> bookkeepingRelationTypes;

    public InMemoryGraphStore(GraphRelevanceProperties properties) {
        this.bookkeepingRelationTypes = properties.bookkeepingRelationTypeSet();
    }

    @Autowired
    public InMemoryGraphStore(GraphRelevanceProperties properties,
                              ObjectMapper objectMapper,
                              @Value("${graph.memory.seed-file:}") String seedFile) {
        this(properties);
        logger.warn("⚠️ 正在使用内存图谱（降级模式），数据仅保存在内存中");
        if (StringUtils.isNotBlank(seedFile)) {
            loadSeed(Paths.get(seedFile.trim()), objectMapper);
        }
    }

    /**
     * 种子格式：{"nodes":[{"title","labels","description","source"}], "relations":[{"from","type","to"}]}
     */
    public void loadSeed(Path file, ObjectMapper objectMapper) {
        JsonNode root;
        try (InputStream in = Files.newInputStream(file)) {
            root = objectMapper.readTree(in);
        } catch (IOException e) {
            throw new UncheckedIOException("读取图谱种子失败: " + file, e);
        }

        for (JsonNode node : root.path("nodes")) {
            List<String> labels = new ArrayList<>();
            node.path("labels").forEach(label -> labels.add(label.asText()));
            addNode(node.path("title").asText(), labels,
                textOrNull(node, "description"), textOrNull(node, "source"));
        }
        int relationCount = 0;
        for (JsonNode rel : root.path("relations")) {
            addRelation(rel.path("from").asText(), rel.path("type").asText(), rel.path("to").asText());
            relationCount++;
        }
        logger.info("📥 图谱种子已加载: {} 个节点, {} 条关系", nodes.size(), relationCount);
    }

    public void addNode(String title, List<String> labels, String description, String source) {
        if (StringUtils.isBlank(title)) {
            throw new IllegalArgumentException("节点标题不能为空");
        }
        nodes.put(title, GraphNodeInfo.builder()
            .title(title)
            .labels(labels != null ? new ArrayList<>(labels) : new ArrayList<>())
            .description(description)
            .source(source)
            .build());
        adjacency.computeIfAbsent(title, k -> new CopyOnWriteArrayList<>());
    }

    public void addNode(String title, String... labels) {
        List<String> labelList = new ArrayList<>();
        Collections.addAll(labelList, labels);
        addNode(title, labelList, null, null);
    }

    public void addRelation(String from, String type, String to) {
        if (!nodes.containsKey(from) || !nodes.containsKey(to)) {
            throw new IllegalArgumentException("关系端点不存在: " + from + " -[" + type + "]-> " + to);
        }
        Edge edge = new Edge(from, type, to);
        adjacency.get(from).add(edge);
        if (!from.equals(to)) {
            adjacency.get(to).add(edge);
        }
    }

    @Override
    public Optional<GraphNodeInfo> getNodeInfo(String title, boolean detailed) {
        GraphNodeInfo stored = nodes.get(title);
        if (stored == null) {
            return Optional.empty();
        }
        GraphNodeInfo.GraphNodeInfoBuilder builder = stored.toBuilder()
            .labels(new ArrayList<>(stored.getLabels()))
            .outgoing(new ArrayList<>())
            .incoming(new ArrayList<>());
        if (detailed) {
            Set<RelationRef> outgoing = new LinkedHashSet<>();
            Set<RelationRef> incoming = new LinkedHashSet<>();
            for (Edge edge : adjacency.getOrDefault(title, Collections.emptyList())) {
                if (bookkeepingRelationTypes.contains(edge.type)) {
                    continue;
                }
                if (edge.from.equals(title)) {
                    outgoing.add(new RelationRef(edge.type, edge.to));
                }
                if (edge.to.equals(title)) {
                    incoming.add(new RelationRef(edge.type, edge.from));
                }
            }
            builder.outgoing(new ArrayList<>(outgoing)).incoming(new ArrayList<>(incoming));
        }
        return Optional.of(builder.build());
    }

    @Override
    public Optional<PathRecord> shortestPath(String titleA,
                                             String titleB,
                                             int maxHops,
                                             Set<String> excludedRelationTypes,
                                             Set<String> excludedInteriorLabels,
                                             Set<String> excludedTitles) {
        if (maxHops < 1 || titleA.equals(titleB) || !nodes.containsKey(titleA) || !nodes.containsKey(titleB)) {
            return Optional.empty();
        }

        Map<String, Step> parents = new HashMap<>();
        Map<String, Integer> depth = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        parents.put(titleA, null);
        depth.put(titleA, 0);
        queue.add(titleA);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            int currentDepth = depth.get(current);
            if (currentDepth >= maxHops) {
                continue;
            }
            for (Edge edge : adjacency.getOrDefault(current, Collections.emptyList())) {
                if (excludedRelationTypes.contains(edge.type)) {
                    continue;
                }
                String next = edge.other(current);
                if (parents.containsKey(next)) {
                    continue;
                }
                if (next.equals(titleB)) {
                    parents.put(next, new Step(current, edge.type));
                    return Optional.of(buildPath(parents, titleB));
                }
                if (isExcludedInterior(next, excludedInteriorLabels, excludedTitles)) {
                    continue;
                }
                parents.put(next, new Step(current, edge.type));
                depth.put(next, currentDepth + 1);
                queue.add(next);
            }
        }
        return Optional.empty();
    }

    @Override
    public Optional<String> neighborByRelation(String title, String relationType) {
        for (Edge edge : adjacency.getOrDefault(title, Collections.emptyList())) {
            if (edge.type.equalsIgnoreCase(relationType)) {
                return Optional.of(edge.other(title));
            }
        }
        return Optional.empty();
    }

    private boolean isExcludedInterior(String title, Set<String> excludedLabels, Set<String> excludedTitles) {
        if (excludedTitles.contains(title)) {
            return true;
        }
        for (String label : nodes.get(title).getLabels()) {
            if (excludedLabels.contains(label)) {
                return true;
            }
        }
        return false;
    }

    private PathRecord buildPath(Map<String, Step> parents, String end) {
        List<String> pathNodes = new ArrayList<>();
        List<String> relations = new ArrayList<>();
        String cursor = end;
        Step step = parents.get(cursor);
        pathNodes.add(cursor);
        while (step != null) {
            relations.add(step.relationType);
            cursor = step.previous;
            pathNodes.add(cursor);
            step = parents.get(cursor);
        }
        Collections.reverse(pathNodes);
        Collections.reverse(relations);
        return new PathRecord(pathNodes, relations);
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static final class Edge {
        private final String from;
        private final String type;
        private final String to;

        private Edge(String from, String type, String to) {
            this.from = from;
            this.type = type;
            this.to = to;
        }

        private String other(String endpoint) {
            return from.equals(endpoint) ? to : from;
        }
    }

    private static final class Step {
        private final String previous;
        private final String relationType;

        private Step(String previous, String relationType) {
            this.previous = previous;
            this.relationType = relationType;
        }
    }
}
