package com.pubsync.service.impl;

import cn.hutool.core.util.StrUtil;
import com.pubsync.model.dto.DepartmentMappingDTO;
import com.pubsync.model.enums.HighlightReason;
import com.pubsync.model.vo.DepartmentResolutionVO;
import com.pubsync.service.DepartmentResolveService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 作者院系匹配服务实现
 *
 * @author 席崇援
 */
@Slf4j
@Service
public class DepartmentResolveServiceImpl implements DepartmentResolveService {

    private static final String AUTHOR_SEPARATOR = ";";
    private static final String DEPARTMENT_SEPARATOR = "; ";

    @Override
    public DepartmentResolutionVO resolve(String authorsShort, List<DepartmentMappingDTO> departmentMapping) {
        if (StrUtil.isBlank(authorsShort)) {
            return DepartmentResolutionVO.empty();
        }

        List<DepartmentMappingDTO> mapping = departmentMapping == null ? List.of() : departmentMapping;

        // LinkedHashSet 保留首次出现顺序
        Set<String> departments = new LinkedHashSet<>();
        List<String> notFoundAuthors = new ArrayList<>();

        for (String rawAuthor : authorsShort.split(AUTHOR_SEPARATOR)) {
            String author = rawAuthor.strip();
            if (author.isEmpty()) {
                continue;
            }

            String key = author.toLowerCase(Locale.ROOT);
            boolean found = false;
            for (DepartmentMappingDTO row : mapping) {
                if (row.getAuthorName() == null || !row.getAuthorName().toLowerCase(Locale.ROOT).equals(key)) {
                    continue;
                }
                found = true;
                if (StrUtil.isNotBlank(row.getDepartment())) {
                    departments.add(row.getDepartment().strip());
                }
            }

            if (!found) {
                notFoundAuthors.add(author);
            }
        }

        HighlightReason reason = HighlightReason.NONE;
        if (!notFoundAuthors.isEmpty()) {
            reason = HighlightReason.NOT_FOUND;
        } else if (departments.size() > 1) {
            reason = HighlightReason.MULTIPLE;
        }

        if (reason.needsHighlight()) {
            log.debug("院系需复核: authors={}, reason={}, notFound={}", authorsShort, reason, notFoundAuthors);
        }

        return DepartmentResolutionVO.builder()
                .department(String.join(DEPARTMENT_SEPARATOR, departments))
                .reason(reason)
                .notFoundAuthors(notFoundAuthors)
                .build();
    }
}
