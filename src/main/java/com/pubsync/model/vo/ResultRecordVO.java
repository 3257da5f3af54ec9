package com.pubsync.model.vo;

import com.pubsync.model.enums.HighlightReason;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 对账结果行,字段顺序与 United 表头一致
 *
 * @author 席崇援
 * @since 2025-11-02
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResultRecordVO {

    /**
     * 院系 (Departament)
     */
    private String department;

    /**
     * 本机构作者短名 (Authors)
     */
    private String affiliatedAuthors;

    /**
     * 全部作者 (Authors.1)
     */
    private String allAuthors;

    /**
     * 全部作者全名 (Author full names)
     */
    private String allAuthorFullNames;

    private String title;

    private Integer year;

    private String sourceTitle;

    private String volume;

    private String issue;

    private String articleNumber;

    private String pageStart;

    private String pageEnd;

    private String pageCount;

    /**
     * 数据来源,固定为 Scopus
     */
    private String source;

    // 以下四列留给人工录入
    @Builder.Default
    private String submission = "";

    @Builder.Default
    private String data = "";

    @Builder.Default
    private String amount = "";

    @Builder.Default
    private String quartile = "";

    /**
     * 导出时是否高亮院系单元格(不导出)
     */
    private boolean highlight;

    /**
     * 高亮原因(不导出)
     */
    @Builder.Default
    private HighlightReason highlightReason = HighlightReason.NONE;
}
