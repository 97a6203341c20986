package com.lore.agentic.service.graph;

/**
 * 图数据库访问失败
 */
public class GraphStoreException extends RuntimeException {

    public GraphStoreException(String message) {
        super(message);
    }

    public GraphStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
