package com.lore.agentic.service.graph;

import com.lore.agentic.model.GraphNodeInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * 带缓存的节点信息查询
 *
 * 节点缺失或查询失败都视为"无信息"，不向上抛出。
 */
@Service
public class NodeInfoService {

    private static final Logger logger = LoggerFactory.getLogger(NodeInfoService.class);

    private final GraphStore graphStore;
    private final GraphQueryCache cache;

    public NodeInfoService(GraphStore graphStore, GraphQueryCache cache) {
        this.graphStore = graphStore;
        this.cache = cache;
    }

    public Optional<GraphNodeInfo> find(String title, boolean detailed) {
        Optional<GraphNodeInfo> cached = cache.get(title, detailed);
        if (cached.isPresent()) {
            return cached;
        }

        Optional<GraphNodeInfo> info;
        try {
            info = graphStore.getNodeInfo(title, detailed);
        } catch (GraphStoreException e) {
            logger.warn("节点信息查询失败: {} ({})", title, e.getMessage());
            return Optional.empty();
        }

        if (info.isPresent()) {
            cache.put(title, detailed, info.get());
        } else {
            logger.debug("图谱中没有节点: {}", title);
        }
        return info;
    }
}
