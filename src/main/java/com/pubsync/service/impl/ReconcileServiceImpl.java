package com.pubsync.service.impl;

import cn.hutool.core.collection.CollUtil;
import cn.hutool.core.util.StrUtil;
import com.pubsync.config.ColumnKeys;
import com.pubsync.model.dto.DepartmentMappingDTO;
import com.pubsync.model.dto.ReconcileOptionsDTO;
import com.pubsync.model.dto.ReferenceRecordDTO;
import com.pubsync.model.dto.SourceRecordDTO;
import com.pubsync.model.enums.DuplicateMatchPolicy;
import com.pubsync.model.enums.HighlightReason;
import com.pubsync.model.vo.DepartmentResolutionVO;
import com.pubsync.model.vo.DuplicateDetectionVO;
import com.pubsync.model.vo.ExtractedAuthorsVO;
import com.pubsync.model.vo.ReconcileResultVO;
import com.pubsync.model.vo.ReconcileStatisticsVO;
import com.pubsync.model.vo.ResultRecordVO;
import com.pubsync.service.AffiliationAuthorService;
import com.pubsync.service.DepartmentResolveService;
import com.pubsync.service.DuplicateDetectionService;
import com.pubsync.service.ReconcileService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import top.continew.starter.core.exception.BusinessException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Scopus 对账服务实现
 *
 * @author 席崇援
 * @since 2025-11-02
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReconcileServiceImpl implements ReconcileService {

    private final DuplicateDetectionService duplicateDetectionService;
    private final AffiliationAuthorService affiliationAuthorService;
    private final DepartmentResolveService departmentResolveService;

    @Override
    public ReconcileResultVO process(List<SourceRecordDTO> sourceRecords,
                                     List<ReferenceRecordDTO> referenceRecords,
                                     List<DepartmentMappingDTO> departmentMapping,
                                     ReconcileOptionsDTO options) {
        if (options.getThreshold() < 0 || options.getThreshold() > 100) {
            throw new BusinessException("相似度阈值必须在 0-100 之间: " + options.getThreshold());
        }

        List<SourceRecordDTO> sources = sourceRecords == null ? List.of() : sourceRecords;
        List<ReferenceRecordDTO> references = referenceRecords == null ? List.of() : referenceRecords;
        List<DepartmentMappingDTO> mapping = departmentMapping == null ? List.of() : departmentMapping;

        ReconcileStatisticsVO stats = ReconcileStatisticsVO.builder()
                .originalSourceCount(sources.size())
                .originalReferenceCount(references.size())
                .build();

        log.info("开始对账: Scopus {} 条, United {} 条, 院系对照 {} 条",
                sources.size(), references.size(), mapping.size());

        // 1. 年份过滤
        Set<Integer> years = options.getYears();
        if (CollUtil.isNotEmpty(years)) {
            sources = sources.stream()
                    .filter(r -> r.getYear() != null && years.contains(r.getYear()))
                    .collect(Collectors.toList());
            references = references.stream()
                    .filter(r -> r.getYear() != null && years.contains(r.getYear()))
                    .collect(Collectors.toList());
            log.info("年份过滤 {}: Scopus {} 条, United {} 条", years, sources.size(), references.size());
        }
        stats.setAfterYearFilterSource(sources.size());
        stats.setAfterYearFilterReference(references.size());

        // 2. 标题排除
        List<String> titleExcludes = lowerCaseKeywords(options.getTitleExcludeKeywords());
        if (!titleExcludes.isEmpty()) {
            int beforeCount = sources.size();
            sources = sources.stream()
                    .filter(r -> shouldKeepTitle(r.getTitle(), titleExcludes))
                    .collect(Collectors.toList());
            stats.setExcludedByTitle(beforeCount - sources.size());
            log.info("标题过滤: 排除 {} 条", stats.getExcludedByTitle());
        }
        stats.setAfterTitleFilter(sources.size());

        // 3. 查重
        DuplicateMatchPolicy policy = options.getMatchPolicy() == null
                ? DuplicateMatchPolicy.FIRST_MATCH : options.getMatchPolicy();
        DuplicateDetectionVO detection = duplicateDetectionService.detect(
                sources, references, options.getThreshold(), policy);
        stats.setNewArticles(detection.getNewRecords().size());
        stats.setDuplicatesFound(detection.getDuplicates().size());

        if (detection.getNewRecords().isEmpty()) {
            log.info("没有新论文,对账结束");
            return ReconcileResultVO.builder()
                    .statistics(stats)
                    .duplicates(detection.getDuplicates())
                    .build();
        }

        // 4. 作者提取与院系匹配
        List<ResultRecordVO> records = new ArrayList<>();
        for (SourceRecordDTO record : detection.getNewRecords()) {
            ExtractedAuthorsVO authors = affiliationAuthorService.extract(
                    record.getAuthorsWithAffiliations(),
                    record.getAuthorFullNames(),
                    options.getAffiliationKeywords(),
                    options.getAffiliationExcludeKeywords());

            if (authors.getCount() == 0) {
                stats.setNoAffiliatedAuthors(stats.getNoAffiliatedAuthors() + 1);
                log.debug("无本机构作者,跳过: {}", record.getTitle());
                continue;
            }
            stats.setAffiliatedArticles(stats.getAffiliatedArticles() + 1);

            DepartmentResolutionVO resolution = departmentResolveService.resolve(authors.getAuthorsShort(), mapping);
            if (resolution.isNeedsHighlight()) {
                stats.setHighlightedDepts(stats.getHighlightedDepts() + 1);
                if (resolution.getReason() == HighlightReason.NOT_FOUND) {
                    stats.setNotFoundDepts(stats.getNotFoundDepts() + 1);
                } else {
                    stats.setMultipleDepts(stats.getMultipleDepts() + 1);
                }
            }

            records.add(toResultRecord(record, authors, resolution));
        }

        log.info("对账完成: 新论文 {} 条, 重复 {} 条, 含本机构作者 {} 条, 无本机构作者 {} 条, 需复核 {} 条",
                stats.getNewArticles(), stats.getDuplicatesFound(), stats.getAffiliatedArticles(),
                stats.getNoAffiliatedAuthors(), stats.getHighlightedDepts());

        return ReconcileResultVO.builder()
                .records(records)
                .statistics(stats)
                .duplicates(detection.getDuplicates())
                .build();
    }

    /**
     * 标题为空时保留;命中任一排除子串则排除
     */
    private boolean shouldKeepTitle(String title, List<String> lowerExcludes) {
        if (title == null) {
            return true;
        }
        String lowerTitle = title.toLowerCase(Locale.ROOT);
        for (String keyword : lowerExcludes) {
            if (lowerTitle.contains(keyword)) {
                log.debug("标题命中排除词 '{}': {}", keyword, title);
                return false;
            }
        }
        return true;
    }

    private List<String> lowerCaseKeywords(List<String> keywords) {
        if (CollUtil.isEmpty(keywords)) {
            return List.of();
        }
        return keywords.stream()
                .filter(StrUtil::isNotEmpty)
                .map(k -> k.toLowerCase(Locale.ROOT))
                .collect(Collectors.toList());
    }

    private ResultRecordVO toResultRecord(SourceRecordDTO record, ExtractedAuthorsVO authors,
                                          DepartmentResolutionVO resolution) {
        return ResultRecordVO.builder()
                .department(resolution.getDepartment())
                .affiliatedAuthors(authors.getAuthorsShort())
                .allAuthors(StrUtil.nullToEmpty(record.getAuthors()))
                .allAuthorFullNames(StrUtil.nullToEmpty(record.getAuthorFullNames()))
                .title(record.getTitle())
                .year(record.getYear())
                .sourceTitle(StrUtil.nullToEmpty(record.getSourceTitle()))
                .volume(StrUtil.nullToEmpty(record.getVolume()))
                .issue(StrUtil.nullToEmpty(record.getIssue()))
                .articleNumber(StrUtil.nullToEmpty(record.getArticleNumber()))
                .pageStart(StrUtil.nullToEmpty(record.getPageStart()))
                .pageEnd(StrUtil.nullToEmpty(record.getPageEnd()))
                .pageCount(StrUtil.nullToEmpty(record.getPageCount()))
                .source(ColumnKeys.SOURCE_SCOPUS)
                .highlight(resolution.isNeedsHighlight())
                .highlightReason(resolution.getReason())
                .build();
    }
}
