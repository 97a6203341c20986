package com.lore.agentic.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 图查询线程池（两两最短路径查询并发执行）
 */
@Configuration
public class GraphExecutorConfiguration {

    @Bean(name = "graphQueryExecutor", destroyMethod = "shutdownNow")
    public ExecutorService graphQueryExecutor(GraphRelevanceProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "graph-query-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newFixedThreadPool(Math.max(1, properties.getPoolSize()), factory);
    }
}
