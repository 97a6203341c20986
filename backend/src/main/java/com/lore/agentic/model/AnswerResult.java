package com.lore.agentic.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * 回答生成结果
 */
@Getter
@AllArgsConstructor
public class AnswerResult {

    /**
     * 模型给出的回答原文
     */
    private final String answer;

    /**
     * 按 (标题, 链接) 去重后的来源，保持出现顺序
     */
    private final List<SourceRef> sources;

    /**
     * 回答 + 来源列表，可直接展示
     */
    private final String text;
}
