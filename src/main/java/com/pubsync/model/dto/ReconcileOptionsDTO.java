package com.pubsync.model.dto;

import com.pubsync.model.enums.DuplicateMatchPolicy;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Set;

/**
 * 单次对账参数
 * 由调用方显式传入,不依赖全局配置,便于多套配置并存
 *
 * @author 席崇援
 * @since 2025-11-02
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconcileOptionsDTO {

    /**
     * 标题相似度阈值(0-100)
     */
    @Builder.Default
    private int threshold = 90;

    /**
     * 年份过滤,null 或空集合表示不过滤
     */
    private Set<Integer> years;

    /**
     * 标题排除子串
     */
    private List<String> titleExcludeKeywords;

    /**
     * 机构关键词
     */
    private List<String> affiliationKeywords;

    /**
     * 机构排除关键词
     */
    private List<String> affiliationExcludeKeywords;

    /**
     * 重复判定策略
     */
    @Builder.Default
    private DuplicateMatchPolicy matchPolicy = DuplicateMatchPolicy.FIRST_MATCH;
}
