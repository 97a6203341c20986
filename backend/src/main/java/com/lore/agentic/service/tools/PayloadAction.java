package com.lore.agentic.service.tools;

import com.lore.agentic.model.OptimizerPayload;
import com.lore.agentic.model.PayloadNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * 工具执行结果：一个作用于优化器工作集的动作
 *
 * 工具本身不持有工作集，由优化器在 Execute 阶段统一应用，返回给模型的观察文本。
 */
public abstract class PayloadAction {

    public abstract String applyTo(OptimizerPayload payload);

    public static PayloadAction deleteNodes(Collection<String> ids) {
        return new DeleteNodes(ids);
    }

    public static PayloadAction addNodes(List<PayloadNode> nodes) {
        return new AddNodes(nodes, null);
    }

    public static PayloadAction notFound(String status) {
        return new AddNodes(Collections.<PayloadNode>emptyList(), status);
    }

    static final class DeleteNodes extends PayloadAction {
        private final List<String> ids;

        private DeleteNodes(Collection<String> ids) {
            this.ids = new ArrayList<>(ids);
        }

        @Override
        public String applyTo(OptimizerPayload payload) {
            int removed = payload.removeByIds(ids);
            return "Removed nodes: " + removed;
        }
    }

    static final class AddNodes extends PayloadAction {
        private final List<PayloadNode> nodes;
        private final String status;

        private AddNodes(List<PayloadNode> nodes, String status) {
            this.nodes = new ArrayList<>(nodes);
            this.status = status;
        }

        @Override
        public String applyTo(OptimizerPayload payload) {
            int added = payload.addAbsent(nodes);
            if (status != null) {
                return "Added nodes: " + added + " (" + status + ")";
            }
            return "Added nodes: " + added;
        }
    }
}
