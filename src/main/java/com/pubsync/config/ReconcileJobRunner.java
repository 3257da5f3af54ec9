package com.pubsync.config;

import cn.hutool.core.util.StrUtil;
import com.pubsync.model.dto.DepartmentMappingDTO;
import com.pubsync.model.dto.ReconcileOptionsDTO;
import com.pubsync.model.dto.ReferenceRecordDTO;
import com.pubsync.model.dto.SourceRecordDTO;
import com.pubsync.model.vo.ExportResultVO;
import com.pubsync.model.vo.ReconcileResultVO;
import com.pubsync.model.vo.ReconcileStatisticsVO;
import com.pubsync.service.ReconcileService;
import com.pubsync.service.ReportExportService;
import com.pubsync.service.TabularLoadService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;
import top.continew.starter.core.exception.BusinessException;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 对账任务启动器
 * 应用启动时按配置读取文件、执行对账并导出结果
 *
 * <pre>
 * java -jar pubsync.jar \
 *   --reconcile.input.source-file=scopus.xlsx \
 *   --reconcile.input.reference-file=united.xlsx \
 *   --reconcile.input.department-file=departments.xlsx \
 *   --reconcile.years=2025
 * </pre>
 *
 * @author 席崇援
 * @since 2025-11-02
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReconcileJobRunner implements CommandLineRunner {

    private final ReconcileProperties reconcileProperties;
    private final TabularLoadService tabularLoadService;
    private final ReconcileService reconcileService;
    private final ReportExportService reportExportService;

    @Override
    public void run(String... args) {
        ReconcileProperties.InputConfig input = reconcileProperties.getInput();
        if (StrUtil.isBlank(input.getSourceFile())) {
            log.info("未配置 reconcile.input.source-file,跳过对账任务");
            return;
        }
        if (StrUtil.isBlank(input.getReferenceFile())) {
            throw new BusinessException("未配置 United 论文库文件: reconcile.input.reference-file");
        }

        // 1. 读取文件
        List<SourceRecordDTO> sourceRecords = tabularLoadService.loadSourceRecords(Paths.get(input.getSourceFile()));
        List<ReferenceRecordDTO> referenceRecords = tabularLoadService.loadReferenceRecords(
                Paths.get(input.getReferenceFile()), input.getReferenceSheet());
        List<DepartmentMappingDTO> departmentMapping = tabularLoadService.loadDepartmentMapping(
                StrUtil.isBlank(input.getDepartmentFile()) ? null : Paths.get(input.getDepartmentFile()));

        // 2. 对账
        ReconcileOptionsDTO options = reconcileProperties.toOptions();
        ReconcileResultVO result = reconcileService.process(sourceRecords, referenceRecords, departmentMapping, options);
        logStatistics(result.getStatistics());

        if (result.getRecords().isEmpty()) {
            log.warn("没有需要导出的新论文");
            return;
        }

        // 3. 导出
        String fileName = reportExportService.buildOutputFileName(options.getYears(), LocalDateTime.now());
        Path outputFile = Paths.get(reconcileProperties.getOutputDir()).resolve(fileName);
        ExportResultVO exported = reportExportService.export(
                result.getRecords(), outputFile, reconcileProperties.getHighlightColor());

        if (!Boolean.TRUE.equals(exported.getSuccess())) {
            throw new BusinessException("结果导出失败: " + exported.getMessage());
        }
        log.info("结果已写入 {} ({} 行, 黄色高亮的院系单元格需人工复核: {} 行)",
                exported.getFile(), exported.getRowCount(), exported.getHighlightedCount());
    }

    private void logStatistics(ReconcileStatisticsVO stats) {
        log.info("===========================================================");
        log.info("Scopus 原始记录: {} (年份过滤后 {}, 标题过滤后 {}, 标题排除 {})",
                stats.getOriginalSourceCount(), stats.getAfterYearFilterSource(),
                stats.getAfterTitleFilter(), stats.getExcludedByTitle());
        log.info("United 原始记录: {} (年份过滤后 {})",
                stats.getOriginalReferenceCount(), stats.getAfterYearFilterReference());
        log.info("新论文: {}, 重复: {}", stats.getNewArticles(), stats.getDuplicatesFound());
        log.info("含本机构作者: {}, 无本机构作者: {}", stats.getAffiliatedArticles(), stats.getNoAffiliatedAuthors());
        log.info("需复核院系: {} (未匹配 {}, 多院系 {})",
                stats.getHighlightedDepts(), stats.getNotFoundDepts(), stats.getMultipleDepts());
        log.info("===========================================================");
    }
}
