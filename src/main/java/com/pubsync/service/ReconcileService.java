package com.pubsync.service;

import com.pubsync.model.dto.DepartmentMappingDTO;
import com.pubsync.model.dto.ReconcileOptionsDTO;
import com.pubsync.model.dto.ReferenceRecordDTO;
import com.pubsync.model.dto.SourceRecordDTO;
import com.pubsync.model.vo.ReconcileResultVO;

import java.util.List;

/**
 * Scopus 对账服务
 * 年份/标题过滤 → 查重 → 本机构作者提取 → 院系匹配
 *
 * @author 席崇援
 */
public interface ReconcileService {

    /**
     * 执行一次对账
     *
     * @param sourceRecords     Scopus 导出记录
     * @param referenceRecords  United 论文库记录
     * @param departmentMapping 作者-院系对照表
     * @param options           本次对账参数
     * @return 新论文结果行、统计信息及重复命中信息
     */
    ReconcileResultVO process(List<SourceRecordDTO> sourceRecords,
                              List<ReferenceRecordDTO> referenceRecords,
                              List<DepartmentMappingDTO> departmentMapping,
                              ReconcileOptionsDTO options);
}
