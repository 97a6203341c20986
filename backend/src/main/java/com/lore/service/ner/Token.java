package com.lore.service.ner;

import lombok.Value;

/**
 * 分词结果：词文本及其在原文中的半开区间 [start, end)
 */
@Value
public class Token {

    String text;

    int start;

    int end;
}
