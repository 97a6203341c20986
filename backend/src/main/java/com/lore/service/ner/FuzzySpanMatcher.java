package com.lore.service.ner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * 词典模糊匹配
 *
 * 在词元序列上滑动 1..maxWindow 个词的窗口，小写片段与词典条目逐一计算相似度，
 * 分数不低于阈值即输出候选片段。纯函数，无副作用。
 */
@Component
public class FuzzySpanMatcher {

    private static final Logger logger = LoggerFactory.getLogger(FuzzySpanMatcher.class);

    public static final double DEFAULT_CUTOFF = 82.0;
    public static final int DEFAULT_MAX_WINDOW = 5;

    private final WordTokenizer tokenizer;
    private final int maxWindow;

    @Autowired
    public FuzzySpanMatcher(WordTokenizer tokenizer,
                            @Value("${entity.match.max-window:5}") int maxWindow) {
        if (maxWindow < 1) {
            throw new IllegalArgumentException("entity.match.max-window 必须 >= 1");
        }
        this.tokenizer = tokenizer;
        this.maxWindow = maxWindow;
    }

    public FuzzySpanMatcher(WordTokenizer tokenizer) {
        this(tokenizer, DEFAULT_MAX_WINDOW);
    }

    public List<CandidateSpan> match(String text, Gazetteer gazetteer) {
        return match(text, gazetteer, DEFAULT_CUTOFF);
    }

    public List<CandidateSpan> match(String text, Gazetteer gazetteer, double cutoff) {
        if (text == null || text.isEmpty() || gazetteer == null || gazetteer.isEmpty()) {
            return Collections.emptyList();
        }

        List<Token> tokens = tokenizer.tokenize(text);
        List<String> lowered = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            lowered.add(token.getText().toLowerCase(Locale.ROOT));
        }

        List<CandidateSpan> candidates = new ArrayList<>();
        for (int i = 0; i < tokens.size(); i++) {
            int last = Math.min(i + maxWindow, tokens.size());
            for (int j = i + 1; j <= last; j++) {
                String fragment = String.join(" ", lowered.subList(i, j));
                int start = tokens.get(i).getStart();
                int end = tokens.get(j - 1).getEnd();
                String original = text.substring(start, end);

                for (GazetteerEntry entry : gazetteer.candidatesFor(fragment.length(), cutoff)) {
                    double score = FuzzyRatio.ratio(fragment, entry.getKey());
                    if (score >= cutoff) {
                        candidates.add(new CandidateSpan(original, start, end,
                            entry.getCanonical(), score, CandidateSpan.SOURCE_GAZETTEER));
                    }
                }
            }
        }

        logger.debug("词典匹配完成: tokens={}, candidates={}, cutoff={}", tokens.size(), candidates.size(), cutoff);
        return candidates;
    }
}
