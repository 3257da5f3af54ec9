package com.pubsync.utils;

import org.apache.commons.text.similarity.LongestCommonSubsequence;

import java.util.HashMap;
import java.util.Map;

/**
 * 字符级相似度工具类
 *
 * <p>得分基于只含插入/删除的编辑距离:
 * {@code ratio = (|a| + |b| - distance) / (|a| + |b|) = 2 * LCS / (|a| + |b|)},
 * 换算为 0-100 的整数(四舍六入五成双)。长度按 Unicode 码点计算。
 * 两个字符串相同(包括都为空串)时得分为 100,否则任一为空时得分为 0。</p>
 *
 * @author 席崇援
 */
public final class SimilarityUtils {

    private static final LongestCommonSubsequence LCS = new LongestCommonSubsequence();

    private static final char SURROGATE_START = '\uD800';
    private static final int SURROGATE_RANGE = 0x800;

    private SimilarityUtils() {}

    /**
     * 计算两个字符串的相似度,结果对称
     *
     * @param left  字符串 A
     * @param right 字符串 B
     * @return 0-100,任一为 null 时返回 0
     */
    public static int ratio(String left, String right) {
        if (left == null || right == null) {
            return 0;
        }
        if (left.equals(right)) {
            return 100;
        }
        if (left.isEmpty() || right.isEmpty()) {
            return 0;
        }

        int leftLength = left.codePointCount(0, left.length());
        int rightLength = right.codePointCount(0, right.length());
        int common;
        if (leftLength == left.length() && rightLength == right.length()) {
            common = LCS.apply(left, right);
        } else {
            // 含增补字符时,把每个码点映射为单个 char 再求 LCS
            Map<Integer, Character> symbols = new HashMap<>();
            common = LCS.apply(toSymbols(left, symbols), toSymbols(right, symbols));
        }
        return (int) Math.rint(100.0 * 2 * common / (leftLength + rightLength));
    }

    /**
     * 两个字符串共用同一映射表,相同码点得到相同的 char;跳过代理区
     */
    private static String toSymbols(String text, Map<Integer, Character> symbols) {
        StringBuilder builder = new StringBuilder(text.length());
        text.codePoints().forEach(codePoint -> builder.append(symbols.computeIfAbsent(codePoint, k -> {
            int next = symbols.size() + 1;
            if (next >= SURROGATE_START) {
                next += SURROGATE_RANGE;
            }
            return (char) next;
        })));
        return builder.toString();
    }
}
