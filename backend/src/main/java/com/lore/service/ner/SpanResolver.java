package com.lore.service.ner;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * 重叠片段消解
 *
 * 1. 按 (小写文本, 区间, 来源) 去重，重复时保留最后出现的值；
 * 2. 按起点升序、终点降序排序；
 * 3. 贪心扫描：与第一个重叠的已接受片段比较 (分数, 文本长度)，严格更优才替换，
 *    否则丢弃候选。被丢弃的片段之后不会再被考虑。
 */
@Component
public class SpanResolver {

    private static final Comparator<CandidateSpan> ORDER = Comparator
        .comparingInt(CandidateSpan::getStart)
        .thenComparing(Comparator.comparingInt(CandidateSpan::getEnd).reversed());

    private static final Comparator<CandidateSpan> QUALITY = Comparator
        .comparingDouble(CandidateSpan::scoreOrZero)
        .thenComparingInt(CandidateSpan::length);

    public List<CandidateSpan> resolve(List<CandidateSpan> candidates) {
        List<CandidateSpan> ordered = deduplicate(candidates);
        ordered.sort(ORDER);

        List<CandidateSpan> result = new ArrayList<>();
        for (CandidateSpan candidate : ordered) {
            boolean overlapped = false;
            Iterator<CandidateSpan> it = result.iterator();
            while (it.hasNext()) {
                CandidateSpan accepted = it.next();
                if (candidate.overlaps(accepted)) {
                    if (QUALITY.compare(candidate, accepted) > 0) {
                        it.remove();
                        result.add(candidate);
                    }
                    overlapped = true;
                    break;
                }
            }
            if (!overlapped) {
                result.add(candidate);
            }
        }
        return result;
    }

    private List<CandidateSpan> deduplicate(List<CandidateSpan> candidates) {
        Map<SpanKey, CandidateSpan> byKey = new LinkedHashMap<>();
        if (candidates != null) {
            for (CandidateSpan span : candidates) {
                byKey.put(SpanKey.of(span), span);
            }
        }
        return new ArrayList<>(byKey.values());
    }

    private static final class SpanKey {
        private final String text;
        private final int start;
        private final int end;
        private final String source;

        private SpanKey(String text, int start, int end, String source) {
            this.text = text;
            this.start = start;
            this.end = end;
            this.source = source;
        }

        static SpanKey of(CandidateSpan span) {
            String lowered = span.getText() != null ? span.getText().toLowerCase(Locale.ROOT) : null;
            return new SpanKey(lowered, span.getStart(), span.getEnd(), span.getSource());
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof SpanKey)) {
                return false;
            }
            SpanKey other = (SpanKey) o;
            return start == other.start && end == other.end
                && Objects.equals(text, other.text) && Objects.equals(source, other.source);
        }

        @Override
        public int hashCode() {
            return Objects.hash(text, start, end, source);
        }
    }
}
