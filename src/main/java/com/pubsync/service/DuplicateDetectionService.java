package com.pubsync.service;

import com.pubsync.model.dto.ReferenceRecordDTO;
import com.pubsync.model.dto.SourceRecordDTO;
import com.pubsync.model.enums.DuplicateMatchPolicy;
import com.pubsync.model.vo.DuplicateDetectionVO;

import java.util.List;

/**
 * 标题模糊查重服务
 *
 * @author 席崇援
 */
public interface DuplicateDetectionService {

    /**
     * 找出论文库中不存在的 Scopus 记录(首个命中即判重)
     *
     * @param sourceRecords    Scopus 记录
     * @param referenceRecords 论文库记录
     * @param threshold        相似度阈值(0-100)
     * @return 新记录及重复命中信息
     */
    default DuplicateDetectionVO detect(List<SourceRecordDTO> sourceRecords,
                                        List<ReferenceRecordDTO> referenceRecords,
                                        int threshold) {
        return detect(sourceRecords, referenceRecords, threshold, DuplicateMatchPolicy.FIRST_MATCH);
    }

    /**
     * 找出论文库中不存在的 Scopus 记录
     *
     * @param sourceRecords    Scopus 记录
     * @param referenceRecords 论文库记录
     * @param threshold        相似度阈值(0-100)
     * @param policy           匹配策略
     * @return 新记录及重复命中信息
     */
    DuplicateDetectionVO detect(List<SourceRecordDTO> sourceRecords,
                                List<ReferenceRecordDTO> referenceRecords,
                                int threshold,
                                DuplicateMatchPolicy policy);
}
