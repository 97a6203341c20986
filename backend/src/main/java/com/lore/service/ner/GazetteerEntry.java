package com.lore.service.ner;

import lombok.Value;

import java.util.Locale;

/**
 * 词典条目：规范名 + 小写检索键
 */
@Value
public class GazetteerEntry {

    String canonical;

    String key;

    public static GazetteerEntry of(String canonical) {
        return new GazetteerEntry(canonical, canonical.toLowerCase(Locale.ROOT));
    }
}
