package com.pubsync.model.vo;

import com.pubsync.model.dto.SourceRecordDTO;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 查重结果
 *
 * @author 席崇援
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DuplicateDetectionVO {

    /**
     * 论文库中不存在的记录,保持输入顺序
     */
    @Builder.Default
    private List<SourceRecordDTO> newRecords = new ArrayList<>();

    /**
     * 每条被排除记录的命中信息
     */
    @Builder.Default
    private List<DuplicateMatchVO> duplicates = new ArrayList<>();
}
