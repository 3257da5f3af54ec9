package com.pubsync.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Scopus 导出中的一条文献记录
 *
 * @author 席崇援
 * @since 2025-11-02
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceRecordDTO {

    /**
     * 论文标题
     */
    private String title;

    /**
     * 发表年份,缺失时为 null
     */
    private Integer year;

    /**
     * 全部作者(短名,分号分隔)
     */
    private String authors;

    /**
     * 作者及机构: "LastName, FirstName, affiliation; ..."
     */
    private String authorsWithAffiliations;

    /**
     * 作者全名及 Scopus ID: "LastName, FirstName (ID); ..."
     */
    private String authorFullNames;

    /**
     * 期刊/会议名称
     */
    private String sourceTitle;

    private String volume;

    private String issue;

    /**
     * 文章编号 (Art. No.)
     */
    private String articleNumber;

    private String pageStart;

    private String pageEnd;

    private String pageCount;
}
