package com.lore.agentic.service.graph;

import com.lore.agentic.model.GraphNodeInfo;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

public class GraphQueryCacheTest {

    private final AtomicLong now = new AtomicLong(1_000);
    private final GraphQueryCache cache = new GraphQueryCache(100, now::get);

    @Test
    void detailedAndPlainEntriesAreSeparate() {
        cache.put("Terra", true, GraphNodeInfo.titleOnly("Terra"));

        assertTrue(cache.get("Terra", true).isPresent());
        assertFalse(cache.get("Terra", false).isPresent());
    }

    @Test
    void entriesExpireAfterTtl() {
        cache.put("Terra", false, GraphNodeInfo.titleOnly("Terra"));

        now.addAndGet(100);
        assertTrue(cache.get("Terra", false).isPresent());
        now.addAndGet(1);
        assertFalse(cache.get("Terra", false).isPresent());
    }

    @Test
    void scheduledCleanupRemovesExpiredEntries() {
        cache.put("Terra", false, GraphNodeInfo.titleOnly("Terra"));
        now.addAndGet(50);
        cache.put("Cadia", false, GraphNodeInfo.titleOnly("Cadia"));
        now.addAndGet(60);

        cache.cleanExpiredCache();

        // 时钟回拨后条目本应仍在有效期内，只有被清理过才会缺失
        now.set(1_060);
        assertFalse(cache.get("Terra", false).isPresent());
        assertTrue(cache.get("Cadia", false).isPresent());
    }
}
