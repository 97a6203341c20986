package com.lore.service.ner;

/**
 * 不做词形变化，直接返回规范名
 */
public class PassThroughInflectionAdapter implements InflectionAdapter {

    @Override
    public String inflect(String sourceWord, String canonicalForm) {
        return canonicalForm;
    }
}
