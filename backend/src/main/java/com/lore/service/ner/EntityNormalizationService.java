package com.lore.service.ner;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 实体抽取与文本规范化
 *
 * 抽取 = 词典模糊匹配 + 重叠消解；规范化则把消解后的片段替换为（变形后的）规范名。
 */
@Service
public class EntityNormalizationService {

    private static final Logger logger = LoggerFactory.getLogger(EntityNormalizationService.class);

    private final Gazetteer gazetteer;
    private final FuzzySpanMatcher matcher;
    private final SpanResolver resolver;
    private final InflectionAdapter inflectionAdapter;
    private final double defaultCutoff;

    public EntityNormalizationService(Gazetteer gazetteer,
                                      FuzzySpanMatcher matcher,
                                      SpanResolver resolver,
                                      InflectionAdapter inflectionAdapter,
                                      @Value("${entity.match.cutoff:82}") double defaultCutoff) {
        this.gazetteer = gazetteer;
        this.matcher = matcher;
        this.resolver = resolver;
        this.inflectionAdapter = inflectionAdapter;
        this.defaultCutoff = defaultCutoff;
    }

    public double getDefaultCutoff() {
        return defaultCutoff;
    }

    public List<CandidateSpan> extract(String text) {
        return extract(text, defaultCutoff);
    }

    public List<CandidateSpan> extract(String text, double cutoff) {
        List<CandidateSpan> candidates = matcher.match(text, gazetteer, cutoff);
        return resolver.resolve(candidates);
    }

    public String normalize(String text) {
        return normalize(text, defaultCutoff);
    }

    /**
     * 从右到左替换，保证左侧偏移量在改写过程中始终有效
     */
    public String normalize(String text, double cutoff) {
        List<CandidateSpan> entities = new ArrayList<>(extract(text, cutoff));
        if (entities.isEmpty()) {
            return text;
        }
        entities.sort(Comparator.comparingInt(CandidateSpan::getStart).reversed());

        StringBuilder corrected = new StringBuilder(text);
        int replaced = 0;
        for (CandidateSpan entity : entities) {
            if (entity.getCanonical() == null) {
                continue;
            }
            String original = corrected.substring(entity.getStart(), entity.getEnd());
            corrected.replace(entity.getStart(), entity.getEnd(), inflectToMatch(original, entity.getCanonical()));
            replaced++;
        }

        logger.debug("文本规范化: 替换 {} 处实体", replaced);
        return corrected.toString();
    }

    /**
     * 按原词的语法特征变形规范名；原词或规范名首字母大写时结果首字母大写
     */
    String inflectToMatch(String sourceWord, String canonicalForm) {
        String inflected = null;
        try {
            inflected = inflectionAdapter.inflect(sourceWord, canonicalForm);
        } catch (RuntimeException e) {
            logger.warn("词形变化失败，使用规范名: {} -> {}", sourceWord, canonicalForm, e);
        }
        String result = inflected == null || inflected.isEmpty() ? canonicalForm : inflected;

        if (startsUpper(canonicalForm) || startsUpper(sourceWord)) {
            result = StringUtils.capitalize(result);
        }
        return result;
    }

    private boolean startsUpper(String value) {
        return value != null && !value.isEmpty() && Character.isUpperCase(value.charAt(0));
    }
}
