package com.pubsync.model.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 对账结果
 *
 * @author 席崇援
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconcileResultVO {

    /**
     * 新论文结果行
     */
    @Builder.Default
    private List<ResultRecordVO> records = new ArrayList<>();

    /**
     * 统计信息
     */
    private ReconcileStatisticsVO statistics;

    /**
     * 被判定为重复的记录
     */
    @Builder.Default
    private List<DuplicateMatchVO> duplicates = new ArrayList<>();
}
