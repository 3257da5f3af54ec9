package com.pubsync.utils;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("字符串相似度")
class SimilarityUtilsTest {

    @Test
    @DisplayName("相同字符串得分 100")
    void identical() {
        assertThat(SimilarityUtils.ratio("deep learning", "deep learning")).isEqualTo(100);
    }

    @Test
    @DisplayName("完全不同的字符串得分 0")
    void disjoint() {
        assertThat(SimilarityUtils.ratio("abc", "xyz")).isZero();
    }

    @Test
    @DisplayName("按 2*LCS/(|a|+|b|) 计算并取整")
    void partialMatch() {
        // LCS("abc","abd") = 2, 4/6 = 66.7
        assertThat(SimilarityUtils.ratio("abc", "abd")).isEqualTo(67);
        // LCS("kitten","sitting") = 4, 8/13 = 61.5
        assertThat(SimilarityUtils.ratio("kitten", "sitting")).isEqualTo(62);
        // 前缀: 46/50
        assertThat(SimilarityUtils.ratio("deep learning in healthcare", "deep learning in health"))
                .isEqualTo(92);
    }

    @Test
    @DisplayName("结果对称")
    void symmetric() {
        String a = "machine learning for climate";
        String b = "learning machines in climate science";
        assertThat(SimilarityUtils.ratio(a, b)).isEqualTo(SimilarityUtils.ratio(b, a));
    }

    @Test
    @DisplayName("仅一侧为空时得分 0")
    void emptyInput() {
        assertThat(SimilarityUtils.ratio("", "abc")).isZero();
        assertThat(SimilarityUtils.ratio("abc", "")).isZero();
        assertThat(SimilarityUtils.ratio("abc", null)).isZero();
        assertThat(SimilarityUtils.ratio(null, null)).isZero();
    }

    @Test
    @DisplayName("两个空串视为相同,得分 100")
    void bothEmpty() {
        assertThat(SimilarityUtils.ratio("", "")).isEqualTo(100);
    }

    @Test
    @DisplayName("增补字符按一个码点计算")
    void supplementaryCharacters() {
        // U+1D400 与 U+1D401 共用同一个高代理项
        String boldA = "\uD835\uDC00";
        String boldB = "\uD835\uDC01";

        assertThat(SimilarityUtils.ratio(boldA, boldB)).isZero();
        // 2 个码点对 2 个码点,公共 1 个: 2/4
        assertThat(SimilarityUtils.ratio(boldA + "b", boldA + "c")).isEqualTo(50);
        assertThat(SimilarityUtils.ratio(boldA + "xyz", boldA + "xyz")).isEqualTo(100);
        assertThat(SimilarityUtils.ratio("a" + boldA + "bc", "abc")).isEqualTo(86);
    }

    @Test
    @DisplayName("得分位于 0-100")
    void bounded() {
        String[][] pairs = {{"a", "ab"}, {"abcdef", "fedcba"}, {"x", "xxxxxxxxxx"}};
        for (String[] pair : pairs) {
            assertThat(SimilarityUtils.ratio(pair[0], pair[1])).isBetween(0, 100);
        }
    }
}
