package com.pubsync.service.impl;

import cn.hutool.core.io.FileUtil;
import cn.hutool.core.util.StrUtil;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.pubsync.config.ColumnKeys;
import com.pubsync.model.dto.DepartmentMappingDTO;
import com.pubsync.model.dto.ReferenceRecordDTO;
import com.pubsync.model.dto.SourceRecordDTO;
import com.pubsync.service.TabularLoadService;
import com.pubsync.utils.NumberConversionUtils;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.EncryptedDocumentException;
import org.apache.poi.ooxml.POIXMLException;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.apache.poi.util.RecordFormatException;
import org.springframework.stereotype.Service;
import top.continew.starter.core.exception.BusinessException;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 表格文件读取服务实现
 *
 * <p>Excel 使用 Apache POI 读取,csv 使用 Jackson CSV 读取。
 * 缺失的列一律按空值处理,不会导致整行失败。
 * 表头重复时,后出现的列依次加后缀 ".1"、".2"(United 表中两列 Authors 即为 "Authors" 与 "Authors.1")。</p>
 *
 * @author 席崇援
 */
@Slf4j
@Service
public class TabularLoadServiceImpl implements TabularLoadService {

    private static final String BOM = "\uFEFF";

    private final CsvMapper csvMapper = new CsvMapper();

    @Override
    public List<SourceRecordDTO> loadSourceRecords(Path file) {
        List<Map<String, String>> rows = readRows(file, null);
        warnMissingColumns(file, rows, List.of(
                ColumnKeys.TITLE, ColumnKeys.YEAR, ColumnKeys.AUTHORS,
                ColumnKeys.AUTHORS_WITH_AFFILIATIONS, ColumnKeys.AUTHOR_FULL_NAMES));

        List<SourceRecordDTO> records = new ArrayList<>(rows.size());
        for (Map<String, String> row : rows) {
            records.add(SourceRecordDTO.builder()
                    .title(cell(row, ColumnKeys.TITLE))
                    .year(NumberConversionUtils.toInteger(cell(row, ColumnKeys.YEAR)))
                    .authors(cell(row, ColumnKeys.AUTHORS))
                    .authorsWithAffiliations(cell(row, ColumnKeys.AUTHORS_WITH_AFFILIATIONS))
                    .authorFullNames(cell(row, ColumnKeys.AUTHOR_FULL_NAMES))
                    .sourceTitle(cell(row, ColumnKeys.SOURCE_TITLE))
                    .volume(cell(row, ColumnKeys.VOLUME))
                    .issue(cell(row, ColumnKeys.ISSUE))
                    .articleNumber(cell(row, ColumnKeys.ARTICLE_NUMBER))
                    .pageStart(cell(row, ColumnKeys.PAGE_START))
                    .pageEnd(cell(row, ColumnKeys.PAGE_END))
                    .pageCount(cell(row, ColumnKeys.PAGE_COUNT))
                    .build());
        }
        log.info("Scopus 文件读取完成: file={}, records={}", file.getFileName(), records.size());
        return records;
    }

    @Override
    public List<ReferenceRecordDTO> loadReferenceRecords(Path file, String sheetName) {
        List<Map<String, String>> rows = readRows(file, sheetName);
        warnMissingColumns(file, rows, List.of(ColumnKeys.TITLE, ColumnKeys.YEAR));

        List<ReferenceRecordDTO> records = new ArrayList<>(rows.size());
        for (Map<String, String> row : rows) {
            records.add(ReferenceRecordDTO.builder()
                    .title(cell(row, ColumnKeys.TITLE))
                    .year(NumberConversionUtils.toInteger(cell(row, ColumnKeys.YEAR)))
                    .build());
        }
        log.info("United 文件读取完成: file={}, sheet={}, records={}", file.getFileName(), sheetName, records.size());
        return records;
    }

    @Override
    public List<DepartmentMappingDTO> loadDepartmentMapping(Path file) {
        if (file == null) {
            log.info("未提供院系对照表,所有作者将标记为未匹配");
            return new ArrayList<>();
        }

        List<Map<String, String>> rows = readRows(file, null);
        warnMissingColumns(file, rows, List.of(ColumnKeys.AUTHOR_NAME, ColumnKeys.DEPARTMENT));

        List<DepartmentMappingDTO> mapping = new ArrayList<>(rows.size());
        for (Map<String, String> row : rows) {
            mapping.add(DepartmentMappingDTO.builder()
                    .authorName(cell(row, ColumnKeys.AUTHOR_NAME))
                    .department(cell(row, ColumnKeys.DEPARTMENT))
                    .build());
        }
        log.info("院系对照表读取完成: file={}, rows={}", file.getFileName(), mapping.size());
        return mapping;
    }

    @Override
    public List<Map<String, String>> readRows(Path file, String sheetName) {
        if (file == null || !Files.isRegularFile(file)) {
            throw new BusinessException("文件不存在: " + file);
        }

        String extension = StrUtil.nullToEmpty(FileUtil.extName(file.getFileName().toString())).toLowerCase();
        return switch (extension) {
            case "xlsx", "xls" -> readExcel(file, sheetName);
            case "csv" -> readCsv(file);
            default -> throw new BusinessException("不支持的文件格式: " + file.getFileName() + " (仅支持 xlsx、xls、csv)");
        };
    }

    /**
     * 读取 Excel 工作表,首行为表头
     */
    private List<Map<String, String>> readExcel(Path file, String sheetName) {
        try (InputStream in = Files.newInputStream(file);
             Workbook workbook = WorkbookFactory.create(in)) {

            Sheet sheet = StrUtil.isBlank(sheetName) ? workbook.getSheetAt(0) : workbook.getSheet(sheetName);
            if (sheet == null) {
                throw new BusinessException("工作表不存在: " + sheetName + " (" + file.getFileName() + ")");
            }

            DataFormatter formatter = new DataFormatter();
            FormulaEvaluator evaluator = workbook.getCreationHelper().createFormulaEvaluator();

            Row headerRow = sheet.getRow(sheet.getFirstRowNum());
            if (headerRow == null) {
                return new ArrayList<>();
            }

            List<String> rawHeaders = new ArrayList<>();
            for (int c = 0; c < headerRow.getLastCellNum(); c++) {
                Cell cell = headerRow.getCell(c);
                rawHeaders.add(cell == null ? "" : formatter.formatCellValue(cell, evaluator));
            }
            List<String> headers = dedupeHeaders(rawHeaders);

            List<Map<String, String>> rows = new ArrayList<>();
            for (int r = sheet.getFirstRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                if (row == null) {
                    continue;
                }
                Map<String, String> values = new LinkedHashMap<>();
                boolean blank = true;
                for (int c = 0; c < headers.size(); c++) {
                    Cell cell = row.getCell(c);
                    String value = cell == null ? "" : formatter.formatCellValue(cell, evaluator);
                    if (!value.isBlank()) {
                        blank = false;
                    }
                    values.put(headers.get(c), value);
                }
                if (!blank) {
                    rows.add(values);
                }
            }
            return rows;

        } catch (IOException | IllegalArgumentException | POIXMLException
                 | EncryptedDocumentException | RecordFormatException e) {
            // 空文件、损坏的压缩包、加密文件等
            log.error("Excel 文件读取失败: {}", file, e);
            throw new BusinessException("Excel 文件读取失败: " + file.getFileName());
        }
    }

    /**
     * 读取 csv,首行为表头
     */
    private List<Map<String, String>> readCsv(Path file) {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             MappingIterator<Map<String, String>> iterator = csvMapper.readerFor(Map.class)
                     .with(schema)
                     .readValues(reader)) {

            List<Map<String, String>> rows = new ArrayList<>();
            // hasNextValue/nextValue 以 IOException 抛出后续行的解析和解码错误
            while (iterator.hasNextValue()) {
                Map<String, String> raw = iterator.nextValue();
                Map<String, String> values = new LinkedHashMap<>();
                boolean blank = true;
                for (Map.Entry<String, String> entry : raw.entrySet()) {
                    String value = StrUtil.nullToEmpty(entry.getValue());
                    if (!value.isBlank()) {
                        blank = false;
                    }
                    values.put(cleanHeader(entry.getKey()), value);
                }
                if (!blank) {
                    rows.add(values);
                }
            }
            return rows;

        } catch (IOException e) {
            log.error("CSV 文件读取失败: {}", file, e);
            throw new BusinessException("CSV 文件读取失败: " + file.getFileName());
        }
    }

    private List<String> dedupeHeaders(List<String> rawHeaders) {
        Map<String, Integer> seen = new HashMap<>();
        List<String> headers = new ArrayList<>(rawHeaders.size());
        for (String raw : rawHeaders) {
            String header = cleanHeader(raw);
            int occurrence = seen.merge(header, 1, Integer::sum);
            headers.add(occurrence == 1 ? header : header + "." + (occurrence - 1));
        }
        return headers;
    }

    private String cleanHeader(String header) {
        return StrUtil.removePrefix(StrUtil.nullToEmpty(header), BOM).strip();
    }

    /**
     * 按列名取值,列不存在时返回空串
     */
    private String cell(Map<String, String> row, String column) {
        return StrUtil.nullToEmpty(row.get(column));
    }

    private void warnMissingColumns(Path file, List<Map<String, String>> rows, List<String> expected) {
        if (rows.isEmpty()) {
            return;
        }
        List<String> missing = expected.stream()
                .filter(column -> !rows.get(0).containsKey(column))
                .toList();
        if (!missing.isEmpty()) {
            log.warn("文件缺少列,按空值处理: file={}, columns={}", file.getFileName(), missing);
        }
    }
}
