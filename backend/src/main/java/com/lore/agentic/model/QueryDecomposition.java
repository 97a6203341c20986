package com.lore.agentic.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 问题拆解结果：子问题 + 原问题中的实体（基本形式）
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class QueryDecomposition {

    private List<String> entities = new ArrayList<>();

    private List<String> questions = new ArrayList<>();

    public static QueryDecomposition empty() {
        return new QueryDecomposition(new ArrayList<>(), new ArrayList<>());
    }

    public boolean isEmpty() {
        return entities.isEmpty() && questions.isEmpty();
    }
}
