package com.lore.service.ner;

/**
 * 归一化编辑距离相似度（0-100）
 *
 * 基于插入/删除编辑距离：ratio = 100 * (1 - indel / (|a| + |b|))，
 * 其中 indel = |a| + |b| - 2 * LCS(a, b)。结果与参数顺序无关。
 */
public final class FuzzyRatio {

    private FuzzyRatio() {
    }

    public static double ratio(String a, String b) {
        int total = a.length() + b.length();
        if (total == 0) {
            return 100.0;
        }
        int lcs = longestCommonSubsequence(a, b);
        return 200.0 * lcs / total;
    }

    /**
     * 给定两个长度，能达到的最高相似度
     */
    public static double upperBound(int lengthA, int lengthB) {
        int total = lengthA + lengthB;
        if (total == 0) {
            return 100.0;
        }
        return 200.0 * Math.min(lengthA, lengthB) / total;
    }

    static int longestCommonSubsequence(String a, String b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0;
        }
        // 短串作为列，滚动数组
        String rows = a.length() >= b.length() ? a : b;
        String cols = rows == a ? b : a;
        int[] prev = new int[cols.length() + 1];
        int[] curr = new int[cols.length() + 1];
        for (int i = 1; i <= rows.length(); i++) {
            char rc = rows.charAt(i - 1);
            for (int j = 1; j <= cols.length(); j++) {
                if (rc == cols.charAt(j - 1)) {
                    curr[j] = prev[j - 1] + 1;
                } else {
                    curr[j] = Math.max(prev[j], curr[j - 1]);
                }
            }
            int[] tmp = prev;
            prev = curr;
            curr = tmp;
        }
        return prev[cols.length()];
    }
}
