package com.pubsync.config;

import java.util.List;

/**
 * 表格列名常量
 * Scopus 导出、United 论文库、院系对照表与结果表共用
 */
public final class ColumnKeys {
    private ColumnKeys() {}

    // Scopus / United 输入列
    public static final String TITLE = "Title";
    public static final String YEAR = "Year";
    public static final String AUTHORS = "Authors";
    public static final String AUTHORS_WITH_AFFILIATIONS = "Authors with affiliations";
    public static final String AUTHOR_FULL_NAMES = "Author full names";
    public static final String SOURCE_TITLE = "Source title";
    public static final String VOLUME = "Volume";
    public static final String ISSUE = "Issue";
    public static final String ARTICLE_NUMBER = "Art. No.";
    public static final String PAGE_START = "Page start";
    public static final String PAGE_END = "Page end";
    public static final String PAGE_COUNT = "Page count";

    // 院系对照表
    public static final String AUTHOR_NAME = "Author Name";
    public static final String DEPARTMENT = "Departament"; // 与 United 表头拼写保持一致

    // 结果表独有列
    public static final String ALL_AUTHORS = "Authors.1";
    public static final String SOURCE = "Source";
    public static final String SUBMISSION = "Təqdimat";
    public static final String DATA = "Data";
    public static final String AMOUNT = "Amount";
    public static final String QUARTILE = "Quartil";

    public static final String SOURCE_SCOPUS = "Scopus";

    /**
     * 结果表列顺序
     */
    public static final List<String> RESULT_COLUMNS = List.of(
            DEPARTMENT, AUTHORS, ALL_AUTHORS, AUTHOR_FULL_NAMES, TITLE, YEAR,
            SOURCE_TITLE, VOLUME, ISSUE, ARTICLE_NUMBER, PAGE_START, PAGE_END, PAGE_COUNT,
            SOURCE, SUBMISSION, DATA, AMOUNT, QUARTILE
    );
}
