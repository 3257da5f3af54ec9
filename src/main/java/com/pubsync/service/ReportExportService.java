package com.pubsync.service;

import com.pubsync.model.vo.ExportResultVO;
import com.pubsync.model.vo.ResultRecordVO;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

/**
 * 结果导出服务
 *
 * @author 席崇援
 */
public interface ReportExportService {

    /**
     * 导出为 xlsx,需复核的院系单元格按指定颜色填充
     *
     * @param records        结果行
     * @param outputFile     输出文件
     * @param highlightColor RGB 十六进制颜色,如 FFFF00
     * @return 导出结果,失败时携带原因而不抛出异常
     */
    ExportResultVO export(List<ResultRecordVO> records, Path outputFile, String highlightColor);

    /**
     * 生成输出文件名: new_articles_{年份}_{时间}.xlsx
     *
     * @param years     过滤年份,为空时记为 all_years
     * @param timestamp 生成时间
     * @return 文件名
     */
    String buildOutputFileName(Collection<Integer> years, LocalDateTime timestamp);
}
