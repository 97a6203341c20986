package com.lore.agentic.service.llm;

/**
 * 大模型调用失败（网络、超时、HTTP 错误）
 */
public class ReasoningEngineException extends RuntimeException {

    public ReasoningEngineException(String message) {
        super(message);
    }

    public ReasoningEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
