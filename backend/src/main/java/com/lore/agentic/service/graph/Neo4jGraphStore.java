package com.lore.agentic.service.graph;

import com.lore.agentic.config.GraphRelevanceProperties;
import com.lore.agentic.model.GraphNodeInfo;
import com.lore.agentic.model.PathRecord;
import com.lore.agentic.model.RelationRef;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Record;
import org.neo4j.driver.Session;
import org.neo4j.driver.Value;
import org.neo4j.driver.exceptions.Neo4jException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Neo4j 图数据库实现
 *
 * 节点以 title 属性为键，描述取 first_paragraph，原文链接取 source 或 url。
 */
@Service
@ConditionalOnProperty(name = "graph.neo4j.enabled", havingValue = "true")
public class Neo4jGraphStore implements GraphStore {

    private static final Logger logger = LoggerFactory.getLogger(Neo4jGraphStore.class);

    private static final String NODE_INFO_QUERY =
        "MATCH (n {title: $title}) " +
        "RETURN n.title AS title, n.first_paragraph AS text, labels(n) AS labels, " +
        "       coalesce(n.source, n.url) AS source " +
        "LIMIT 1";

    private static final String NODE_INFO_DETAILED_QUERY =
        "MATCH (n {title: $title}) " +
        "WITH n LIMIT 1 " +
        "OPTIONAL MATCH (n)-[out_rel]->(out_node) " +
        "  WHERE NOT type(out_rel) IN $bookkeeping " +
        "WITH n, collect(DISTINCT {rel: type(out_rel), target: out_node.title}) AS outgoing " +
        "OPTIONAL MATCH (in_node)-[in_rel]->(n) " +
        "  WHERE NOT type(in_rel) IN $bookkeeping " +
        "RETURN n.title AS title, n.first_paragraph AS text, labels(n) AS labels, " +
        "       coalesce(n.source, n.url) AS source, outgoing, " +
        "       collect(DISTINCT {rel: type(in_rel), source: in_node.title}) AS incoming";

    // 变长模式的上限不能参数化，只能拼入查询
    private static final String SHORTEST_PATH_QUERY_TEMPLATE =
        "MATCH p=(a {title: $titleA})-[rels*..%d]-(b {title: $titleB}) " +
        "WHERE all(r IN rels WHERE NOT type(r) IN $excludedRelationTypes) " +
        "  AND none(n IN nodes(p)[1..-1] WHERE " +
        "        any(l IN labels(n) WHERE l IN $excludedLabels) " +
        "        OR n.title IN $excludedTitles) " +
        "RETURN [n IN nodes(p) | n.title] AS path, " +
        "       [r IN relationships(p) | type(r)] AS rels, " +
        "       length(p) AS pathLength " +
        "ORDER BY pathLength ASC " +
        "LIMIT 1";

    private static final String NEIGHBOR_QUERY =
        "MATCH (n {title: $title})-[r]-(m) " +
        "WHERE toUpper(type(r)) = toUpper($relType) " +
        "RETURN m.title AS targetTitle " +
        "LIMIT 1";

    private final Driver driver;
    private final Set<String> bookkeepingRelationTypes;

    public Neo4jGraphStore(Driver driver, GraphRelevanceProperties properties) {
        this.driver = driver;
        this.bookkeepingRelationTypes = properties.bookkeepingRelationTypeSet();
    }

    @Override
    public Optional<GraphNodeInfo> getNodeInfo(String title, boolean detailed) {
        Map<String, Object> params = new HashMap<>();
        params.put("title", title);
        if (detailed) {
            params.put("bookkeeping", new ArrayList<>(bookkeepingRelationTypes));
        }

        List<Record> records = run(detailed ? NODE_INFO_DETAILED_QUERY : NODE_INFO_QUERY, params);
        if (records.isEmpty()) {
            return Optional.empty();
        }
        Record record = records.get(0);
        String storedTitle = nullableString(record.get("title"));

        GraphNodeInfo.GraphNodeInfoBuilder builder = GraphNodeInfo.builder()
            .title(storedTitle != null ? storedTitle : title)
            .labels(record.get("labels").asList(Value::asString))
            .description(nullableString(record.get("text")))
            .source(nullableString(record.get("source")));

        if (detailed) {
            builder.outgoing(toRelations(record.get("outgoing"), "target"));
            builder.incoming(toRelations(record.get("incoming"), "source"));
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
        if (maxHops < 1) {
            return Optional.empty();
        }
        Map<String, Object> params = new HashMap<>();
        params.put("titleA", titleA);
        params.put("titleB", titleB);
        params.put("excludedRelationTypes", new ArrayList<>(excludedRelationTypes));
        params.put("excludedLabels", new ArrayList<>(excludedInteriorLabels));
        params.put("excludedTitles", new ArrayList<>(excludedTitles));

        List<Record> records = run(String.format(SHORTEST_PATH_QUERY_TEMPLATE, maxHops), params);
        if (records.isEmpty() || records.get(0).get("pathLength").isNull()) {
            return Optional.empty();
        }
        Record record = records.get(0);
        List<String> nodes = record.get("path").asList(v -> v.isNull() ? "" : v.asString());
        List<String> relations = record.get("rels").asList(Value::asString);
        return Optional.of(new PathRecord(nodes, relations));
    }

    @Override
    public Optional<String> neighborByRelation(String title, String relationType) {
        Map<String, Object> params = new HashMap<>();
        params.put("title", title);
        params.put("relType", relationType);

        List<Record> records = run(NEIGHBOR_QUERY, params);
        if (records.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(nullableString(records.get(0).get("targetTitle")));
    }

    private List<Record> run(String cypher, Map<String, Object> params) {
        try (Session session = driver.session()) {
            return session.run(cypher, params).list();
        } catch (Neo4jException e) {
            logger.error("❌ Neo4j查询失败: {}", e.getMessage());
            throw new GraphStoreException("Neo4j查询失败: " + e.getMessage(), e);
        }
    }

    private List<RelationRef> toRelations(Value value, String endpointKey) {
        List<RelationRef> relations = new ArrayList<>();
        if (value == null || value.isNull()) {
            return relations;
        }
        for (Value item : value.values()) {
            Value endpoint = item.get(endpointKey);
            Value rel = item.get("rel");
            // OPTIONAL MATCH 无结果时会收集到 {rel: null, target: null}
            if (endpoint.isNull() || rel.isNull()) {
                continue;
            }
            relations.add(new RelationRef(rel.asString(), endpoint.asString()));
        }
        return relations;
    }

    private String nullableString(Value value) {
        return value == null || value.isNull() ? null : value.asString();
    }
}
