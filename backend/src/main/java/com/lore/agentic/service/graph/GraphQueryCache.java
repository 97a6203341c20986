package com.lore.agentic.service.graph;

import com.lore.agentic.model.GraphNodeInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

/**
 * 节点信息缓存
 *
 * 同一轮检索和相邻几轮检索会反复读取同一批节点，缓存在 TTL 内有效，定时清理过期条目。
 * 不缓存"节点不存在"的结果。
 */
@Component
public class GraphQueryCache {

    private static final Logger logger = LoggerFactory.getLogger(GraphQueryCache.class);

    private final Map<String, CacheEntry> cache = new ConcurrentHashMap<>();
    private final long ttlMillis;
    private final LongSupplier clock;

    public GraphQueryCache(@Value("${graph.cache.ttl-ms:300000}") long ttlMillis) {
        this(ttlMillis, System::currentTimeMillis);
    }

    GraphQueryCache(long ttlMillis, LongSupplier clock) {
        this.ttlMillis = ttlMillis;
        this.clock = clock;
    }

    public Optional<GraphNodeInfo> get(String title, boolean detailed) {
        String key = buildKey(title, detailed);
        CacheEntry entry = cache.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (isExpired(entry, clock.getAsLong())) {
            cache.remove(key);
            logger.debug("缓存过期: {}", key);
            return Optional.empty();
        }
        logger.debug("缓存命中: {}", key);
        return Optional.of(entry.info);
    }

    public void put(String title, boolean detailed, GraphNodeInfo info) {
        cache.put(buildKey(title, detailed), new CacheEntry(clock.getAsLong(), info));
    }

    @Scheduled(fixedRateString = "${graph.cache.cleanup-interval-ms:600000}")
    public void cleanExpiredCache() {
        long now = clock.getAsLong();
        int removedCount = 0;

        Iterator<Map.Entry<String, CacheEntry>> iterator = cache.entrySet().iterator();
        while (iterator.hasNext()) {
            if (isExpired(iterator.next().getValue(), now)) {
                iterator.remove();
                removedCount++;
            }
        }

        if (removedCount > 0) {
            logger.info("清理过期节点缓存: 移除{}个条目", removedCount);
        }
    }

    private boolean isExpired(CacheEntry entry, long now) {
        return now - entry.timestamp > ttlMillis;
    }

    private String buildKey(String title, boolean detailed) {
        return (detailed ? "detailed:" : "plain:") + title;
    }

    private static final class CacheEntry {
        private final long timestamp;
        private final GraphNodeInfo info;

        private CacheEntry(long timestamp, GraphNodeInfo info) {
            this.timestamp = timestamp;
            this.info = info;
        }
    }
}
