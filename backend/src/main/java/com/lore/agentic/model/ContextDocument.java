package com.lore.agentic.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 交给回答生成环节的上下文文档
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ContextDocument {

    private String title;

    private String content;

    private Map<String, Object> metadata;
}
