package com.pubsync.service.impl;

import cn.hutool.core.collection.CollUtil;
import cn.hutool.core.util.HexUtil;
import cn.hutool.core.util.StrUtil;
import com.pubsync.config.ColumnKeys;
import com.pubsync.model.vo.ExportResultVO;
import com.pubsync.model.vo.ResultRecordVO;
import com.pubsync.service.ReportExportService;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFCellStyle;
import org.apache.poi.xssf.usermodel.XSSFColor;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Service;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 结果导出服务实现
 *
 * @author 席崇援
 */
@Slf4j
@Service
public class ReportExportServiceImpl implements ReportExportService {

    private static final String SHEET_NAME = "Sheet1";
    private static final DateTimeFormatter FILE_TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd_HH-mm-ss");

    /**
     * 院系列在结果表中的位置
     */
    private static final int DEPARTMENT_COLUMN = ColumnKeys.RESULT_COLUMNS.indexOf(ColumnKeys.DEPARTMENT);

    @Override
    public ExportResultVO export(List<ResultRecordVO> records, Path outputFile, String highlightColor) {
        if (CollUtil.isEmpty(records)) {
            log.warn("没有可导出的记录: {}", outputFile);
            return ExportResultVO.failure("没有可导出的记录");
        }

        byte[] rgb = parseColor(highlightColor);
        if (rgb == null) {
            log.error("高亮颜色格式错误: {}", highlightColor);
            return ExportResultVO.failure("高亮颜色格式错误: " + highlightColor);
        }

        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet(SHEET_NAME);

            XSSFCellStyle highlightStyle = workbook.createCellStyle();
            highlightStyle.setFillForegroundColor(new XSSFColor(rgb, null));
            highlightStyle.setFillPattern(FillPatternType.SOLID_FOREGROUND);

            Row header = sheet.createRow(0);
            for (int c = 0; c < ColumnKeys.RESULT_COLUMNS.size(); c++) {
                header.createCell(c).setCellValue(ColumnKeys.RESULT_COLUMNS.get(c));
            }

            int highlighted = 0;
            for (int i = 0; i < records.size(); i++) {
                ResultRecordVO record = records.get(i);
                Row row = sheet.createRow(i + 1);
                List<Object> values = toRowValues(record);
                for (int c = 0; c < values.size(); c++) {
                    writeCell(row, c, values.get(c));
                }

                if (record.isHighlight()) {
                    Cell departmentCell = row.getCell(DEPARTMENT_COLUMN);
                    if (departmentCell == null) {
                        departmentCell = row.createCell(DEPARTMENT_COLUMN);
                    }
                    departmentCell.setCellStyle(highlightStyle);
                    highlighted++;
                }
            }

            Path parent = outputFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream out = Files.newOutputStream(outputFile)) {
                workbook.write(out);
            }

            log.info("结果导出完成: file={}, rows={}, highlighted={}", outputFile, records.size(), highlighted);
            return ExportResultVO.success(outputFile, records.size(), highlighted);

        } catch (Exception e) {
            log.error("结果导出失败: {}", outputFile, e);
            return ExportResultVO.failure("导出失败: " + e.getMessage());
        }
    }

    @Override
    public String buildOutputFileName(Collection<Integer> years, LocalDateTime timestamp) {
        String yearPart = CollUtil.isEmpty(years)
                ? "all_years"
                : years.stream().sorted().map(String::valueOf).collect(Collectors.joining("-"));
        return "new_articles_" + yearPart + "_" + FILE_TIME_FORMAT.format(timestamp) + ".xlsx";
    }

    /**
     * 与 {@link ColumnKeys#RESULT_COLUMNS} 顺序一致,不含高亮字段
     */
    private List<Object> toRowValues(ResultRecordVO record) {
        return Arrays.asList(
                record.getDepartment(),
                record.getAffiliatedAuthors(),
                record.getAllAuthors(),
                record.getAllAuthorFullNames(),
                record.getTitle(),
                record.getYear(),
                record.getSourceTitle(),
                record.getVolume(),
                record.getIssue(),
                record.getArticleNumber(),
                record.getPageStart(),
                record.getPageEnd(),
                record.getPageCount(),
                record.getSource(),
                record.getSubmission(),
                record.getData(),
                record.getAmount(),
                record.getQuartile()
        );
    }

    private void writeCell(Row row, int column, Object value) {
        if (value instanceof Integer number) {
            row.createCell(column).setCellValue(number);
        } else if (value instanceof String text && !text.isEmpty()) {
            row.createCell(column).setCellValue(text);
        }
    }

    /**
     * 解析 RRGGBB,格式错误返回 null
     */
    private byte[] parseColor(String color) {
        String hex = StrUtil.removePrefix(StrUtil.trim(color), "#");
        if (StrUtil.length(hex) != 6 || !hex.chars().allMatch(ch -> Character.digit(ch, 16) >= 0)) {
            return null;
        }
        return HexUtil.decodeHex(hex);
    }
}
