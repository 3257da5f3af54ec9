package com.pubsync.model.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 查重命中信息
 *
 * @author 席崇援
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DuplicateMatchVO {

    /**
     * Scopus 原始标题
     */
    private String sourceTitle;

    /**
     * 命中的论文库标题(规范化后)
     */
    private String matchedTitle;

    /**
     * 相似度(0-100)
     */
    private Integer similarity;
}
