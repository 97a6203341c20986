package com.lore.service.ner;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SpanResolverTest {

    private final SpanResolver resolver = new SpanResolver();

    private static CandidateSpan span(String text, int start, int end, Double score) {
        return new CandidateSpan(text, start, end, text, score, CandidateSpan.SOURCE_GAZETTEER);
    }

    @Test
    @DisplayName("重叠时保留分数更高的片段")
    void higherScoreReplacesOverlappingSpan() {
        CandidateSpan shorter = span("abcde", 0, 5, 90.0);
        CandidateSpan longer = span("cdefghij", 2, 10, 95.0);

        List<CandidateSpan> resolved = resolver.resolve(Arrays.asList(shorter, longer));

        assertEquals(Collections.singletonList(longer), resolved);
    }

    @Test
    void equalScoreKeepsLongerText() {
        CandidateSpan a = span("Horus", 0, 5, 90.0);
        CandidateSpan b = span("Horus Lupercal", 0, 14, 90.0);

        assertEquals(Collections.singletonList(b), resolver.resolve(Arrays.asList(a, b)));
        assertEquals(Collections.singletonList(b), resolver.resolve(Arrays.asList(b, a)));
    }

    @Test
    void equalQualityKeepsFirstAccepted() {
        CandidateSpan a = span("abcd", 0, 4, 90.0);
        CandidateSpan b = span("cdef", 2, 6, 90.0);

        assertEquals(Collections.singletonList(a), resolver.resolve(Arrays.asList(b, a)));
    }

    @Test
    void missingScoreCountsAsZero() {
        CandidateSpan unscored = span("Iron Hands", 0, 10, null);
        CandidateSpan scored = span("Iron", 0, 4, 1.0);

        assertEquals(Collections.singletonList(scored), resolver.resolve(Arrays.asList(unscored, scored)));
    }

    @Test
    void duplicatesKeepLastSeenValue() {
        CandidateSpan first = new CandidateSpan("Terra", 3, 8, "Terra", 85.0, CandidateSpan.SOURCE_GAZETTEER);
        CandidateSpan again = new CandidateSpan("TERRA", 3, 8, "Terra", 99.0, CandidateSpan.SOURCE_GAZETTEER);

        List<CandidateSpan> resolved = resolver.resolve(Arrays.asList(first, again));

        assertEquals(1, resolved.size());
        assertEquals(99.0, resolved.get(0).getScore(), 1e-9);
    }

    @Test
    void resultIsSortedInputOrderIndependentAndNonOverlapping() {
        List<CandidateSpan> candidates = new ArrayList<>(Arrays.asList(
            span("aaaa", 20, 24, 88.0),
            span("bbbbbb", 0, 6, 91.0),
            span("cccc", 4, 8, 83.0),
            span("dddddddd", 10, 18, 97.0),
            span("ee", 16, 18, 99.0)));

        List<CandidateSpan> resolved = resolver.resolve(candidates);
        Collections.reverse(candidates);
        List<CandidateSpan> reversedInput = resolver.resolve(candidates);

        assertEquals(resolved, reversedInput);
        for (int i = 0; i < resolved.size(); i++) {
            for (int j = i + 1; j < resolved.size(); j++) {
                assertFalse(resolved.get(i).overlaps(resolved.get(j)), resolved.get(i) + " / " + resolved.get(j));
            }
        }
    }

    @Test
    void resolvingTwiceGivesSameResult() {
        List<CandidateSpan> candidates = Arrays.asList(
            span("Horus", 0, 5, 90.0),
            span("Horus Lupercal", 0, 14, 95.0),
            span("Lupercal", 6, 14, 99.0),
            span("Terra", 20, 25, 100.0));

        assertEquals(resolver.resolve(candidates), resolver.resolve(candidates));
        List<CandidateSpan> once = resolver.resolve(candidates);
        assertEquals(once, resolver.resolve(once));
    }

    /**
     * 贪心规则被丢弃的片段不会再回来：A 被 B 替换、B 又被 C 替换后，
     * 与 C 不重叠的 A 也不会恢复，结果不是最优的不重叠覆盖 {A, C}。
     */
    @Test
    @DisplayName("贪心消解：被替换的片段不再恢复")
    void greedyResolutionDoesNotRestoreDiscardedSpans() {
        CandidateSpan a = span("aaaaa", 0, 5, 90.0);
        CandidateSpan b = span("bbbbb", 3, 8, 95.0);
        CandidateSpan c = span("cccc", 6, 10, 99.0);

        List<CandidateSpan> resolved = resolver.resolve(Arrays.asList(a, b, c));

        assertEquals(Collections.singletonList(c), resolved);
    }

    @Test
    void emptyAndNullInputs() {
        assertTrue(resolver.resolve(Collections.<CandidateSpan>emptyList()).isEmpty());
        assertTrue(resolver.resolve(null).isEmpty());
    }

    @Test
    void rejectsEmptyInterval() {
        assertThrows(IllegalArgumentException.class, () -> span("x", 3, 3, 10.0));
    }
}
