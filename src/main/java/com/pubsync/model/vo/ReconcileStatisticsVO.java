package com.pubsync.model.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 对账各阶段统计
 *
 * @author 席崇援
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconcileStatisticsVO {

    /**
     * Scopus 原始记录数
     */
    private int originalSourceCount;

    /**
     * United 原始记录数
     */
    private int originalReferenceCount;

    /**
     * 年份过滤后 Scopus 记录数
     */
    private int afterYearFilterSource;

    /**
     * 年份过滤后 United 记录数
     */
    private int afterYearFilterReference;

    /**
     * 标题过滤后 Scopus 记录数
     */
    private int afterTitleFilter;

    /**
     * 按标题排除的记录数
     */
    private int excludedByTitle;

    /**
     * 新论文数
     */
    private int newArticles;

    /**
     * 重复论文数
     */
    private int duplicatesFound;

    /**
     * 含本机构作者的论文数
     */
    private int affiliatedArticles;

    /**
     * 不含本机构作者的论文数
     */
    private int noAffiliatedAuthors;

    /**
     * 需复核院系的论文数
     */
    private int highlightedDepts;

    /**
     * 其中:存在未匹配作者
     */
    private int notFoundDepts;

    /**
     * 其中:匹配到多个院系
     */
    private int multipleDepts;
}
