package com.lore.service.ner;

/**
 * 词形变化能力（外部）
 *
 * 按 sourceWord 的语法特征（数、格、性）对 canonicalForm 进行变形。
 * 无法变形时返回 null 或原规范名，由调用方回退到规范名。
 */
public interface InflectionAdapter {

    String inflect(String sourceWord, String canonicalForm);
}
