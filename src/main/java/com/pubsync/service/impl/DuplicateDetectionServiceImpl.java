package com.pubsync.service.impl;

import com.pubsync.model.dto.ReferenceRecordDTO;
import com.pubsync.model.dto.SourceRecordDTO;
import com.pubsync.model.enums.DuplicateMatchPolicy;
import com.pubsync.model.vo.DuplicateDetectionVO;
import com.pubsync.model.vo.DuplicateMatchVO;
import com.pubsync.service.DuplicateDetectionService;
import com.pubsync.utils.SimilarityUtils;
import com.pubsync.utils.TitleNormalizeUtils;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 标题模糊查重服务实现
 *
 * <p>逐条扫描论文库标题,复杂度 O(n·m)。两侧都是人工维护的有限数据集,
 * 数据量增大时可改为按规范化标题前缀分桶。</p>
 *
 * @author 席崇援
 */
@Slf4j
@Service
public class DuplicateDetectionServiceImpl implements DuplicateDetectionService {

    @Override
    public DuplicateDetectionVO detect(List<SourceRecordDTO> sourceRecords,
                                       List<ReferenceRecordDTO> referenceRecords,
                                       int threshold,
                                       DuplicateMatchPolicy policy) {
        List<String> referenceTitles = new ArrayList<>(referenceRecords.size());
        for (ReferenceRecordDTO reference : referenceRecords) {
            referenceTitles.add(TitleNormalizeUtils.normalize(reference.getTitle()));
        }

        List<SourceRecordDTO> newRecords = new ArrayList<>();
        List<DuplicateMatchVO> duplicates = new ArrayList<>();

        for (SourceRecordDTO record : sourceRecords) {
            String sourceTitle = TitleNormalizeUtils.normalize(record.getTitle());
            Match match = policy == DuplicateMatchPolicy.BEST_MATCH
                    ? findBestMatch(sourceTitle, referenceTitles)
                    : findFirstMatch(sourceTitle, referenceTitles, threshold);

            if (match.title != null && match.score >= threshold) {
                duplicates.add(DuplicateMatchVO.builder()
                        .sourceTitle(record.getTitle())
                        .matchedTitle(match.title)
                        .similarity(match.score)
                        .build());
                log.debug("重复论文: title={}, matched={}, similarity={}",
                        record.getTitle(), match.title, match.score);
            } else {
                newRecords.add(record);
                log.debug("新论文: title={}, bestSimilarity={}", record.getTitle(), match.score);
            }
        }

        log.info("查重完成: 输入 {} 条, 论文库 {} 条, 新论文 {} 条, 重复 {} 条 (threshold={}, policy={})",
                sourceRecords.size(), referenceTitles.size(), newRecords.size(), duplicates.size(),
                threshold, policy);

        return DuplicateDetectionVO.builder()
                .newRecords(newRecords)
                .duplicates(duplicates)
                .build();
    }

    /**
     * 按顺序扫描,第一个达到阈值的标题即为命中;未命中时返回扫描过程中的最高分
     */
    private Match findFirstMatch(String sourceTitle, List<String> referenceTitles, int threshold) {
        Match best = Match.NONE;
        for (String referenceTitle : referenceTitles) {
            int score = SimilarityUtils.ratio(sourceTitle, referenceTitle);
            if (score >= threshold) {
                return new Match(referenceTitle, score);
            }
            if (score > best.score) {
                best = new Match(referenceTitle, score);
            }
        }
        return best;
    }

    /**
     * 扫描全部标题,返回得分最高者(同分取靠前者)
     */
    private Match findBestMatch(String sourceTitle, List<String> referenceTitles) {
        Match best = Match.NONE;
        for (String referenceTitle : referenceTitles) {
            int score = SimilarityUtils.ratio(sourceTitle, referenceTitle);
            if (best.title == null || score > best.score) {
                best = new Match(referenceTitle, score);
            }
        }
        return best;
    }

    /**
     * 单次扫描的命中标题及得分
     */
    @AllArgsConstructor
    private static class Match {
        static final Match NONE = new Match(null, 0);

        private final String title;
        private final int score;
    }
}
