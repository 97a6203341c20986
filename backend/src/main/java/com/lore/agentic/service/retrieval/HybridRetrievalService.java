package com.lore.agentic.service.retrieval;

import com.lore.agentic.model.ContextDocument;
import com.lore.agentic.model.GraphNodeInfo;
import com.lore.agentic.model.GraphRelevanceResult;
import com.lore.agentic.model.NodePair;
import com.lore.agentic.model.OptimizerPayload;
import com.lore.agentic.model.PathRecord;
import com.lore.agentic.model.PayloadNode;
import com.lore.agentic.model.QueryDecomposition;
import com.lore.agentic.model.ScoredChunk;
import com.lore.agentic.service.graph.GraphRelevanceScorer;
import com.lore.agentic.service.graph.NodeInfoService;
import com.lore.agentic.service.orchestrator.GraphContextOptimizer;
import com.lore.service.ner.EntityNormalizationService;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 混合检索：问题拆解 + 向量检索 + 图相关性 + 上下文优化
 *
 * 1. 拆解问题，得到子问题和实体
 * 2. 按子问题、原问题和规范化后的实体做相似度检索
 * 3. 按文档标题合并文本块，去掉重复
 * 4. 图相关性打分，筛选候选文档
 * 5. 构建优化器工作集（候选节点 + 中间节点），交给优化器精简
 * 6. 为剩余节点组装上下文文档
 */
@Service
public class HybridRetrievalService {

    private static final Logger logger = LoggerFactory.getLogger(HybridRetrievalService.class);

    static final String UNTITLED = "Untitled";

    private final QueryDecompositionService decompositionService;
    private final DocumentSearchPort documentSearch;
    private final EntityNormalizationService normalizationService;
    private final GraphRelevanceScorer relevanceScorer;
    private final NodeInfoService nodeInfoService;
    private final GraphContextOptimizer optimizer;
    private final int topKVector;
    private final int topKFinal;

    public HybridRetrievalService(QueryDecompositionService decompositionService,
                                  DocumentSearchPort documentSearch,
                                  EntityNormalizationService normalizationService,
                                  GraphRelevanceScorer relevanceScorer,
                                  NodeInfoService nodeInfoService,
                                  GraphContextOptimizer optimizer,
                                  @Value("${retrieval.top-k-vector:6}") int topKVector,
                                  @Value("${retrieval.top-k-final:10}") int topKFinal) {
        this.decompositionService = decompositionService;
        this.documentSearch = documentSearch;
        this.normalizationService = normalizationService;
        this.relevanceScorer = relevanceScorer;
        this.nodeInfoService = nodeInfoService;
        this.optimizer = optimizer;
        this.topKVector = topKVector;
        this.topKFinal = topKFinal;
    }

    public List<ContextDocument> retrieve(String query) {
        logger.info("🔎 开始混合检索: {}", query);

        QueryDecomposition decomposition = decompositionService.decompose(query);
        List<String> questions = new ArrayList<>(decomposition.getQuestions());
        questions.add(query);

        List<ScoredChunk> collected = new ArrayList<>();
        collected.addAll(searchByQuestions(questions));
        collected.addAll(searchByEntities(decomposition.getEntities()));

        Map<String, List<ScoredChunk>> docToChunks = mergeChunks(collected);
        if (docToChunks.isEmpty()) {
            logger.info("未检索到任何文本块: {}", query);
            return new ArrayList<>();
        }

        GraphRelevanceResult relevance = relevanceScorer.score(docToChunks.keySet());
        List<String> candidates = filterTopK(docToChunks, relevance.getNodeScores());
        logger.info("📊 候选文档: {}/{}", candidates.size(), docToChunks.size());

        OptimizerPayload payload = preparePayload(candidates, relevance);
        OptimizerPayload optimized = optimizer.optimize(query, payload);

        List<ContextDocument> documents = assembleContext(optimized, docToChunks);
        logger.info("✅ 混合检索完成: 上下文文档{}个", documents.size());
        return documents;
    }

    List<ScoredChunk> searchByQuestions(List<String> questions) {
        List<ScoredChunk> collected = new ArrayList<>();
        for (String question : questions) {
            String text = StringUtils.trimToEmpty(question);
            if (!text.isEmpty()) {
                collected.addAll(documentSearch.similaritySearch(text, topKVector));
            }
        }
        return collected;
    }

    List<ScoredChunk> searchByEntities(List<String> entities) {
        List<ScoredChunk> collected = new ArrayList<>();
        for (String entity : entities) {
            String text = StringUtils.trimToEmpty(entity);
            if (!text.isEmpty()) {
                collected.addAll(documentSearch.similaritySearch(normalizationService.normalize(text), topKVector));
            }
        }
        return collected;
    }

    /**
     * 按标题合并，(title, content) 相同的块只保留第一次出现
     */
    Map<String, List<ScoredChunk>> mergeChunks(List<ScoredChunk> collected) {
        Map<String, List<ScoredChunk>> docToChunks = new LinkedHashMap<>();
        Set<String> seen = new HashSet<>();
        for (ScoredChunk chunk : collected) {
            String title = StringUtils.isNotBlank(chunk.getTitle()) ? chunk.getTitle() : UNTITLED;
            String key = title + '\u0000' + StringUtils.trimToEmpty(chunk.getContent());
            if (!seen.add(key)) {
                continue;
            }
            docToChunks.computeIfAbsent(title, t -> new ArrayList<>()).add(chunk);
        }
        return docToChunks;
    }

    /**
     * 保留有图得分或命中多个文本块的文档；超过上限按 得分 + 块数 取前 K；一个都不剩时全部保留
     */
    List<String> filterTopK(Map<String, List<ScoredChunk>> docToChunks, Map<String, Double> nodeScores) {
        List<String> filtered = new ArrayList<>();
        for (Map.Entry<String, List<ScoredChunk>> entry : docToChunks.entrySet()) {
            if (scoreOf(nodeScores, entry.getKey()) > 0 || entry.getValue().size() > 1) {
                filtered.add(entry.getKey());
            }
        }

        if (filtered.size() > topKFinal) {
            filtered.sort((a, b) -> Double.compare(
                scoreOf(nodeScores, b) + docToChunks.get(b).size(),
                scoreOf(nodeScores, a) + docToChunks.get(a).size()));
            filtered = new ArrayList<>(filtered.subList(0, topKFinal));
        }

        if (filtered.isEmpty()) {
            filtered = new ArrayList<>(docToChunks.keySet());
        }
        return filtered;
    }

    /**
     * 候选节点取详细信息并带得分，中间节点只取基本信息、得分为 0；id 依次为 node_1..node_n
     */
    OptimizerPayload preparePayload(List<String> candidates, GraphRelevanceResult relevance) {
        Set<String> candidateSet = new LinkedHashSet<>(candidates);

        Map<NodePair, PathRecord> keptPaths = new LinkedHashMap<>();
        Set<String> intermediates = new LinkedHashSet<>();
        for (Map.Entry<NodePair, PathRecord> entry : relevance.getPaths().entrySet()) {
            NodePair pair = entry.getKey();
            if (!candidateSet.contains(pair.getFrom()) || !candidateSet.contains(pair.getTo())) {
                continue;
            }
            keptPaths.put(pair, entry.getValue());
            for (String interior : entry.getValue().interiorNodes()) {
                if (!candidateSet.contains(interior)) {
                    intermediates.add(interior);
                }
            }
        }

        List<String> titles = new ArrayList<>(candidateSet);
        titles.addAll(intermediates);

        List<PayloadNode> nodes = new ArrayList<>();
        for (int i = 0; i < titles.size(); i++) {
            String title = titles.get(i);
            boolean detailed = candidateSet.contains(title);
            Optional<GraphNodeInfo> info = nodeInfoService.find(title, detailed);
            if (!info.isPresent()) {
                logger.debug("节点不在图谱中，跳过: {}", title);
                continue;
            }
            double score = detailed ? round3(relevance.scoreOf(title)) : 0.0;
            nodes.add(new PayloadNode("node_" + (i + 1), score, info.get()));
        }
        return new OptimizerPayload(nodes, keptPaths);
    }

    List<ContextDocument> assembleContext(OptimizerPayload payload, Map<String, List<ScoredChunk>> docToChunks) {
        List<ContextDocument> documents = new ArrayList<>();
        for (PayloadNode node : payload.getNodes()) {
            GraphNodeInfo info = node.getInfo();
            String title = info != null ? info.getTitle() : null;
            if (StringUtils.isBlank(title)) {
                continue;
            }

            String description = StringUtils.trimToEmpty(info.getDescription());
            List<ScoredChunk> chunks = docToChunks.containsKey(title) ? docToChunks.get(title) : new ArrayList<>();

            String sourceUrl;
            Map<String, Object> metadata;
            if (!chunks.isEmpty()) {
                sourceUrl = chunks.get(0).sourceUrl();
                metadata = new HashMap<>(chunks.get(0).getMetadata());
            } else {
                sourceUrl = info.getSource();
                metadata = new HashMap<>();
                metadata.put("title", title);
                metadata.put("source", sourceUrl);
            }

            if (sourceUrl == null || !sourceUrl.startsWith("http")) {
                logger.warn("跳过节点 {}: 没有有效的 http 来源", title);
                continue;
            }
            if (description.isEmpty() && chunks.isEmpty()) {
                continue;
            }

            List<String> parts = new ArrayList<>();
            parts.add("=== ENTITY: " + title + " ===");
            if (!description.isEmpty()) {
                parts.add("[DESCRIPTION]: " + description);
            }
            if (!chunks.isEmpty()) {
                parts.add("[ADDITIONAL ARCHIVE DATA]:");
                for (int i = 0; i < chunks.size(); i++) {
                    parts.add("Fragment " + (i + 1) + ":\n" + chunks.get(i).getContent());
                }
            }
            documents.add(new ContextDocument(title, String.join("\n\n", parts), metadata));
        }
        return documents;
    }

    private static double scoreOf(Map<String, Double> scores, String title) {
        Double score = scores.get(title);
        return score != null ? score : 0.0;
    }

    private static double round3(double value) {
        return BigDecimal.valueOf(value).setScale(3, RoundingMode.HALF_UP).doubleValue();
    }
}
