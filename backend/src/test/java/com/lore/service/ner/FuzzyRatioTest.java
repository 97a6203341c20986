package com.lore.service.ner;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class FuzzyRatioTest {

    @Test
    @DisplayName("相同字符串得分 100，完全不同得分 0")
    void identicalAndDisjoint() {
        assertEquals(100.0, FuzzyRatio.ratio("iron hand", "iron hand"), 1e-9);
        assertEquals(0.0, FuzzyRatio.ratio("abc", "xyz"), 1e-9);
        assertEquals(100.0, FuzzyRatio.ratio("", ""), 1e-9);
        assertEquals(0.0, FuzzyRatio.ratio("abc", ""), 1e-9);
    }

    @Test
    @DisplayName("基于 LCS 的插入删除比率，与参数顺序无关")
    void indelRatioIsSymmetric() {
        // LCS("the iron hand", "iron hand") = 9, 总长 22
        assertEquals(200.0 * 9 / 22, FuzzyRatio.ratio("the iron hand", "iron hand"), 1e-9);
        assertEquals(FuzzyRatio.ratio("kitten", "sitting"), FuzzyRatio.ratio("sitting", "kitten"), 1e-9);
        // LCS("kitten", "sitting") = 4 ("ittn")
        assertEquals(200.0 * 4 / 13, FuzzyRatio.ratio("kitten", "sitting"), 1e-9);
    }

    @Test
    void upperBoundNeverBelowActualRatio() {
        String[][] pairs = {{"abaddon", "abbadon"}, {"horus", "horus lupercal"}, {"terra", "cadia"}};
        for (String[] pair : pairs) {
            double bound = FuzzyRatio.upperBound(pair[0].length(), pair[1].length());
            assertTrue(bound >= FuzzyRatio.ratio(pair[0], pair[1]), pair[0] + " / " + pair[1]);
        }
        assertEquals(100.0, FuzzyRatio.upperBound(5, 5), 1e-9);
    }
}
