package com.lore.service.ner;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 实体词典（只读）
 *
 * 构建后不可变，可在并发抽取之间共享。条目按小写键长度分桶，
 * 对给定片段长度和阈值只返回长度上仍可能达到阈值的条目，结果与全量比对一致。
 */
public final class Gazetteer {

    private final List<GazetteerEntry> entries;
    private final Map<String, GazetteerEntry> byKey;
    private final TreeMap<Integer, List<GazetteerEntry>> byLength;

    private Gazetteer(List<GazetteerEntry> entries) {
        this.entries = Collections.unmodifiableList(entries);
        Map<String, GazetteerEntry> keyIndex = new LinkedHashMap<>();
        TreeMap<Integer, List<GazetteerEntry>> lengthIndex = new TreeMap<>();
        for (GazetteerEntry entry : entries) {
            keyIndex.putIfAbsent(entry.getKey(), entry);
            lengthIndex.computeIfAbsent(entry.getKey().length(), k -> new ArrayList<>()).add(entry);
        }
        this.byKey = Collections.unmodifiableMap(keyIndex);
        this.byLength = lengthIndex;
    }

    public static Gazetteer of(Collection<String> canonicalNames) {
        Map<String, GazetteerEntry> unique = new LinkedHashMap<>();
        for (String name : canonicalNames) {
            if (name == null) {
                continue;
            }
            String trimmed = name.trim();
            if (!trimmed.isEmpty()) {
                unique.putIfAbsent(trimmed, GazetteerEntry.of(trimmed));
            }
        }
        return new Gazetteer(new ArrayList<>(unique.values()));
    }

    public static Gazetteer empty() {
        return new Gazetteer(new ArrayList<>());
    }

    public List<GazetteerEntry> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * 按小写键精确查找
     */
    public Optional<GazetteerEntry> lookup(String text) {
        if (text == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byKey.get(text.trim().toLowerCase(Locale.ROOT)));
    }

    /**
     * 返回长度上可能与 fragmentLength 达到 cutoff 的条目
     */
    public List<GazetteerEntry> candidatesFor(int fragmentLength, double cutoff) {
        if (cutoff <= 0) {
            return entries;
        }
        List<GazetteerEntry> result = new ArrayList<>();
        for (Map.Entry<Integer, List<GazetteerEntry>> bucket : byLength.entrySet()) {
            if (FuzzyRatio.upperBound(fragmentLength, bucket.getKey()) >= cutoff) {
                result.addAll(bucket.getValue());
            }
        }
        return result;
    }
}
