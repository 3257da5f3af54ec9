package com.pubsync.service;

import com.pubsync.model.dto.DepartmentMappingDTO;
import com.pubsync.model.dto.ReferenceRecordDTO;
import com.pubsync.model.dto.SourceRecordDTO;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * 表格文件读取服务
 * 支持 xlsx、xls、csv
 *
 * @author 席崇援
 */
public interface TabularLoadService {

    /**
     * 读取 Scopus 导出文件(第一个工作表)
     *
     * @param file 文件路径
     * @return 文献记录
     */
    List<SourceRecordDTO> loadSourceRecords(Path file);

    /**
     * 读取 United 论文库
     *
     * @param file      文件路径
     * @param sheetName 工作表名称,为空时读取第一个工作表(csv 忽略)
     * @return 已有记录
     */
    List<ReferenceRecordDTO> loadReferenceRecords(Path file, String sheetName);

    /**
     * 读取作者-院系对照表
     *
     * @param file 文件路径,为 null 时返回空表
     * @return 对照行
     */
    List<DepartmentMappingDTO> loadDepartmentMapping(Path file);

    /**
     * 按表头读取所有数据行
     *
     * @param file      文件路径
     * @param sheetName 工作表名称,为空时读取第一个工作表
     * @return 每行 表头 → 单元格文本
     */
    List<Map<String, String>> readRows(Path file, String sheetName);
}
