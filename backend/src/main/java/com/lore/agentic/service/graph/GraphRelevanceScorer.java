package com.lore.agentic.service.graph;

import com.lore.agentic.config.GraphRelevanceProperties;
import com.lore.agentic.model.GraphRelevanceResult;
import com.lore.agentic.model.NodePair;
import com.lore.agentic.model.PathRecord;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 图相关性打分
 *
 * 对候选标题两两查询受限最短路径，路径长度为 d 时两端各加 1/(1+d)，
 * 同时记录路径（双向）和路径上的中间节点。查询并发提交到线程池，
 * 结果在调用线程中汇总；单个节点对失败或超时按"无路径"处理。
 */
@Service
public class GraphRelevanceScorer {

    private static final Logger logger = LoggerFactory.getLogger(GraphRelevanceScorer.class);

    private final GraphStore graphStore;
    private final GraphRelevanceProperties properties;
    private final ExecutorService executor;

    public GraphRelevanceScorer(GraphStore graphStore,
                                GraphRelevanceProperties properties,
                                @Qualifier("graphQueryExecutor") ExecutorService executor) {
        this.graphStore = graphStore;
        this.properties = properties;
        this.executor = executor;
    }

    public GraphRelevanceResult score(Collection<String> titles) {
        return score(titles, properties.getMaxHops());
    }

    public GraphRelevanceResult score(Collection<String> titles, int maxHops) {
        List<String> candidates = new ArrayList<>();
        for (String title : new LinkedHashSet<>(titles)) {
            if (title != null) {
                candidates.add(title);
            }
        }

        Map<String, Double> nodeScores = new LinkedHashMap<>();
        for (String title : candidates) {
            nodeScores.put(title, 0.0);
        }
        Map<NodePair, PathRecord> paths = new LinkedHashMap<>();
        Set<String> intermediateNodes = new LinkedHashSet<>();

        if (candidates.size() < 2 || maxHops < 1) {
            return new GraphRelevanceResult(nodeScores, paths, intermediateNodes);
        }

        Set<String> excludedRelations = properties.excludedRelationTypeSet();
        Set<String> noiseLabels = properties.noiseLabelSet();
        Set<String> placeholders = properties.placeholderTitleSet();

        List<PairQuery> queries = new ArrayList<>();
        for (int i = 0; i < candidates.size(); i++) {
            for (int j = i + 1; j < candidates.size(); j++) {
                String a = candidates.get(i);
                String b = candidates.get(j);
                Future<Optional<PathRecord>> future = executor.submit(() ->
                    graphStore.shortestPath(a, b, maxHops, excludedRelations, noiseLabels, placeholders));
                queries.add(new PairQuery(a, b, future));
            }
        }

        Set<String> candidateSet = new HashSet<>(candidates);
        int found = 0;
        int failed = 0;
        boolean interrupted = false;
        for (PairQuery query : queries) {
            if (interrupted) {
                query.future.cancel(true);
                continue;
            }
            Optional<PathRecord> path;
            try {
                path = query.future.get(properties.getQueryTimeoutMs(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                query.future.cancel(true);
                logger.warn("⏱️ 路径查询超时，按无路径处理: {} <-> {}", query.a, query.b);
                failed++;
                continue;
            } catch (ExecutionException e) {
                logger.warn("路径查询失败，按无路径处理: {} <-> {} ({})", query.a, query.b, e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
                failed++;
                continue;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                interrupted = true;
                query.future.cancel(true);
                continue;
            }

            if (path == null || !path.isPresent()) {
                continue;
            }
            PathRecord forward = orient(path.get(), query.a);
            double contribution = 1.0 / (1 + forward.length());
            nodeScores.merge(query.a, contribution, Double::sum);
            nodeScores.merge(query.b, contribution, Double::sum);
            paths.put(new NodePair(query.a, query.b), forward);
            paths.put(new NodePair(query.b, query.a), forward.reverse());
            for (String interior : forward.interiorNodes()) {
                if (StringUtils.isNotBlank(interior) && !candidateSet.contains(interior)) {
                    intermediateNodes.add(interior);
                }
            }
            found++;
        }

        if (interrupted) {
            logger.warn("图相关性打分被中断，剩余节点对按无路径处理");
        }
        logger.info("🕸️ 图相关性打分完成: 节点={}, 节点对={}, 有路径={}, 失败={}, 中间节点={}",
            candidates.size(), queries.size(), found, failed, intermediateNodes.size());
        return new GraphRelevanceResult(nodeScores, paths, intermediateNodes);
    }

    private PathRecord orient(PathRecord path, String start) {
        if (!path.first().equals(start) && path.last().equals(start)) {
            return path.reverse();
        }
        return path;
    }

    private static final class PairQuery {
        private final String a;
        private final String b;
        private final Future<Optional<PathRecord>> future;

        private PairQuery(String a, String b, Future<Optional<PathRecord>> future) {
            this.a = a;
            this.b = b;
            this.future = future;
        }
    }
}
