package com.lore.agentic.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 推理引擎请求的一次工具调用
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ToolCall {

    private String id;

    private String name;

    private Map<String, Object> arguments;
}
