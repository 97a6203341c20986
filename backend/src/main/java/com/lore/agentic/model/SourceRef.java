package com.lore.agentic.model;

import lombok.Value;

/**
 * 回答引用的来源：文档标题 + 链接
 */
@Value
public class SourceRef {

    String title;

    String source;
}
