package com.lore.service.ner;

import lombok.Builder;
import lombok.Value;

/**
 * 候选实体片段
 *
 * span 为原文中的半开区间 [start, end)，要求 start < end。消解前多个候选可以相互重叠。
 */
@Value
@Builder(toBuilder = true)
public class CandidateSpan {

    public static final String SOURCE_GAZETTEER = "gazetteer";

    /**
     * 原文中的片段（保留原始大小写）
     */
    String text;

    int start;

    int end;

    /**
     * 规范名，可能为空
     */
    String canonical;

    /**
     * 相似度分数，可能为空
     */
    Double score;

    String source;

    public CandidateSpan(String text, int start, int end, String canonical, Double score, String source) {
        if (start >= end) {
            throw new IllegalArgumentException("非法区间: [" + start + ", " + end + ")");
        }
        this.text = text;
        this.start = start;
        this.end = end;
        this.canonical = canonical;
        this.score = score;
        this.source = source;
    }

    public boolean overlaps(CandidateSpan other) {
        return start < other.end && other.start < end;
    }

    public double scoreOrZero() {
        return score != null ? score : 0.0;
    }

    public int length() {
        return text != null ? text.length() : 0;
    }
}
