package com.pubsync.model.vo;

import com.pubsync.model.enums.HighlightReason;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 院系匹配结果
 *
 * @author 席崇援
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DepartmentResolutionVO {

    /**
     * 去重后的院系,"; " 分隔
     */
    @Builder.Default
    private String department = "";

    /**
     * 高亮原因
     */
    @Builder.Default
    private HighlightReason reason = HighlightReason.NONE;

    /**
     * 对照表中找不到的作者
     */
    @Builder.Default
    private List<String> notFoundAuthors = new ArrayList<>();

    public static DepartmentResolutionVO empty() {
        return DepartmentResolutionVO.builder().build();
    }

    public boolean isNeedsHighlight() {
        return reason.needsHighlight();
    }
}
