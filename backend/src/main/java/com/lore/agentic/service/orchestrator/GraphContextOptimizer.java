package com.lore.agentic.service.orchestrator;

import com.lore.agentic.model.ChatMessage;
import com.lore.agentic.model.EngineDecision;
import com.lore.agentic.model.OptimizerPayload;
import com.lore.agentic.model.ToolCall;
import com.lore.agentic.service.PromptTemplateService;
import com.lore.agentic.service.llm.ReasoningEngine;
import com.lore.agentic.service.llm.ReasoningEngineException;
import com.lore.agentic.service.tools.PayloadAction;
import com.lore.agentic.service.tools.ToolNotFoundException;
import com.lore.agentic.service.tools.ToolRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * 图谱上下文优化器：Decide / Execute 循环
 *
 * 1. DECIDE: 把当前节点集和用户问题交给推理引擎，引擎请求工具调用或直接结束
 * 2. EXECUTE: 依次执行工具调用（删除节点 / 沿关系扩展），观察结果写回对话
 * 3. 回到 DECIDE，直到引擎不再请求工具，或引擎调用次数达到上限
 *
 * 同一个工作集上的循环严格串行，工作集只在 EXECUTE 完整执行后才被修改。
 */
@Service
public class GraphContextOptimizer {

    private static final Logger logger = LoggerFactory.getLogger(GraphContextOptimizer.class);

    static final String PROMPT_TEMPLATE = "graph-optimizer.txt";

    private final ReasoningEngine reasoningEngine;
    private final ToolRegistry toolRegistry;
    private final GraphPayloadFormatter formatter;
    private final PromptTemplateService promptTemplateService;
    private final int maxIterations;

    public GraphContextOptimizer(ReasoningEngine reasoningEngine,
                                 ToolRegistry toolRegistry,
                                 GraphPayloadFormatter formatter,
                                 PromptTemplateService promptTemplateService,
                                 @Value("${optimizer.max-iterations:5}") int maxIterations) {
        this.reasoningEngine = reasoningEngine;
        this.toolRegistry = toolRegistry;
        this.formatter = formatter;
        this.promptTemplateService = promptTemplateService;
        this.maxIterations = maxIterations;
    }

    public OptimizerPayload optimize(String query, OptimizerPayload payload) {
        return optimize(query, payload, () -> false);
    }

    /**
     * 就地修改并返回工作集
     *
     * @param cancelled 每次 DECIDE 前检查，为 true 时结束循环
     * @throws ToolNotFoundException 引擎请求了未注册的工具
     */
    public OptimizerPayload optimize(String query, OptimizerPayload payload, BooleanSupplier cancelled) {
        logger.info("🧠 开始上下文优化: query={}, 节点数={}, 最大引擎调用={}", query, payload.size(), maxIterations);

        List<ChatMessage> conversation = new ArrayList<>();
        conversation.add(ChatMessage.user(query));

        OptimizerState state = OptimizerState.DECIDE;
        EngineDecision decision = null;
        int engineCalls = 0;

        while (state != OptimizerState.DONE) {
            switch (state) {
                case DECIDE:
                    if (cancelled.getAsBoolean()) {
                        logger.info("⏹️ 优化已取消: 已调用引擎{}次", engineCalls);
                        state = OptimizerState.DONE;
                        break;
                    }
                    if (engineCalls >= maxIterations) {
                        logger.warn("⚠️ 达到最大引擎调用次数{}，强制结束", maxIterations);
                        state = OptimizerState.DONE;
                        break;
                    }
                    try {
                        decision = reasoningEngine.decide(buildSystemPrompt(query, payload), conversation,
                            toolRegistry.getAllDefinitions());
                    } catch (ReasoningEngineException e) {
                        logger.warn("推理引擎调用失败，保留当前节点集: {}", e.getMessage());
                        state = OptimizerState.DONE;
                        break;
                    }
                    engineCalls++;
                    conversation.add(decision.toAssistantMessage());
                    logger.info("📍 Step {}/{}: 工具调用{}个", engineCalls, maxIterations, decision.getToolCalls().size());
                    state = decision.isTerminal() ? OptimizerState.DONE : OptimizerState.EXECUTE;
                    break;

                case EXECUTE:
                    List<ResolvedCall> resolved = resolve(decision.getToolCalls());
                    for (ResolvedCall call : resolved) {
                        String observation = call.apply(payload);
                        conversation.add(ChatMessage.tool(call.id, observation));
                    }
                    state = OptimizerState.DECIDE;
                    break;

                default:
                    state = OptimizerState.DONE;
            }
        }

        logger.info("🎉 上下文优化完成: 引擎调用{}次, 剩余节点{}个", engineCalls, payload.size());
        return payload;
    }

    /**
     * 先把整批工具调用解析成动作，未注册的工具在修改工作集之前就抛出
     */
    private List<ResolvedCall> resolve(List<ToolCall> calls) {
        List<ResolvedCall> resolved = new ArrayList<>();
        for (ToolCall call : calls) {
            Map<String, Object> args = call.getArguments() != null ? call.getArguments() : new HashMap<>();
            try {
                resolved.add(new ResolvedCall(call, toolRegistry.executeTool(call.getName(), args), null));
            } catch (ToolNotFoundException e) {
                throw e;
            } catch (Exception e) {
                logger.warn("工具执行失败: {} -> {}", call.getName(), e.getMessage());
                resolved.add(new ResolvedCall(call, null, "Tool " + call.getName() + " failed: " + e.getMessage()));
            }
        }
        return resolved;
    }

    private String buildSystemPrompt(String query, OptimizerPayload payload) {
        Map<String, String> variables = new HashMap<>();
        variables.put("query", query);
        variables.put("graph", formatter.format(payload));
        return promptTemplateService.render(PROMPT_TEMPLATE, variables);
    }

    private static final class ResolvedCall {
        private final String id;
        private final String name;
        private final PayloadAction action;
        private final String failure;

        private ResolvedCall(ToolCall call, PayloadAction action, String failure) {
            this.id = call.getId();
            this.name = call.getName();
            this.action = action;
            this.failure = failure;
        }

        private String apply(OptimizerPayload payload) {
            if (action == null) {
                return failure;
            }
            String observation = action.applyTo(payload);
            logger.info("🔍 {} -> {}", name, observation);
            return observation;
        }
    }
}
