package com.pubsync.service.impl;

import cn.hutool.core.collection.CollUtil;
import cn.hutool.core.util.StrUtil;
import com.pubsync.model.vo.ExtractedAuthorsVO;
import com.pubsync.service.AffiliationAuthorService;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 本机构作者提取服务实现
 *
 * <p>作者块格式: "LastName, FirstName, affiliation, affiliation, ..."。
 * 全名格式: "LastName, FirstName (ID)"。</p>
 *
 * @author 席崇援
 */
@Slf4j
@Service
public class AffiliationAuthorServiceImpl implements AffiliationAuthorService {

    private static final Pattern FULL_NAME_PATTERN = Pattern.compile("(.+?)\\s*\\((\\d+)\\)");

    private static final String BLOCK_SEPARATOR = ";";
    private static final String NAME_SEPARATOR = ",";

    @Override
    public ExtractedAuthorsVO extract(String authorsWithAffiliations, String authorFullNames,
                                      List<String> keywords, List<String> excludeKeywords) {
        if (StrUtil.isBlank(authorsWithAffiliations)) {
            return ExtractedAuthorsVO.empty();
        }

        String[] includes = toKeywordArray(keywords);
        if (includes.length == 0) {
            return ExtractedAuthorsVO.empty();
        }
        String[] excludes = toKeywordArray(excludeKeywords);

        Map<String, List<FullNameEntry>> fullNameIndex = indexFullNames(authorFullNames);
        ExtractedAuthorsVO result = ExtractedAuthorsVO.empty();

        for (String rawBlock : authorsWithAffiliations.split(BLOCK_SEPARATOR)) {
            String block = rawBlock.strip();
            if (block.isEmpty()) {
                continue;
            }

            if (!StrUtil.containsAnyIgnoreCase(block, includes)) {
                continue;
            }
            if (excludes.length > 0 && StrUtil.containsAnyIgnoreCase(block, excludes)) {
                log.debug("作者块命中排除关键词: {}", block);
                continue;
            }

            String[] parts = block.split(NAME_SEPARATOR, -1);
            if (parts.length < 2) {
                continue;
            }
            String lastName = parts[0].strip();
            String firstName = parts[1].strip();

            result.getShortNames().add(toShortName(lastName, firstName));

            FullNameEntry entry = lookup(fullNameIndex, lastName, firstName, result);
            if (entry != null) {
                result.getFullNamesWithIds().add(entry.fullName + " (" + entry.id + ")");
                result.getFullNames().add(entry.fullName);
            } else {
                String fullName = lastName + ", " + firstName;
                result.getFullNamesWithIds().add(fullName);
                result.getFullNames().add(fullName);
            }
        }

        return result;
    }

    /**
     * 解析全名字符串,按姓氏建立索引;格式不符的条目直接跳过
     */
    private Map<String, List<FullNameEntry>> indexFullNames(String authorFullNames) {
        Map<String, List<FullNameEntry>> index = new LinkedHashMap<>();
        if (StrUtil.isBlank(authorFullNames)) {
            return index;
        }

        for (String rawPart : authorFullNames.split(BLOCK_SEPARATOR)) {
            Matcher matcher = FULL_NAME_PATTERN.matcher(rawPart.strip());
            if (!matcher.lookingAt()) {
                continue;
            }
            String name = matcher.group(1).strip();
            String id = matcher.group(2);
            String lastName = StrUtil.subBefore(name, NAME_SEPARATOR, false).strip();
            String firstName = StrUtil.subAfter(name, NAME_SEPARATOR, false).strip();

            List<FullNameEntry> entries = index.computeIfAbsent(lastName, k -> new ArrayList<>());
            // 同一作者重复出现时只保留一次
            if (entries.stream().noneMatch(e -> e.id.equals(id))) {
                entries.add(new FullNameEntry(name, firstName, id));
            }
        }
        return index;
    }

    /**
     * 按姓氏查找全名;同姓多人时依次按全名、首字母区分,仍无法区分则记为歧义
     */
    private FullNameEntry lookup(Map<String, List<FullNameEntry>> index, String lastName,
                                 String firstName, ExtractedAuthorsVO result) {
        List<FullNameEntry> candidates = index.get(lastName);
        if (CollUtil.isEmpty(candidates)) {
            return null;
        }
        if (candidates.size() == 1) {
            return candidates.get(0);
        }

        List<FullNameEntry> exact = candidates.stream()
                .filter(e -> e.firstName.equalsIgnoreCase(firstName))
                .collect(Collectors.toList());
        if (exact.size() == 1) {
            return exact.get(0);
        }

        if (!firstName.isEmpty()) {
            List<FullNameEntry> sameInitial = candidates.stream()
                    .filter(e -> !e.firstName.isEmpty()
                            && Character.toLowerCase(e.firstName.charAt(0)) == Character.toLowerCase(firstName.charAt(0)))
                    .collect(Collectors.toList());
            if (sameInitial.size() == 1) {
                return sameInitial.get(0);
            }
        }

        String author = lastName + ", " + firstName;
        result.getAmbiguousAuthors().add(author);
        log.warn("同姓作者无法区分,未附加 ID: author={}, candidates={}", author,
                candidates.stream().map(e -> e.fullName + " (" + e.id + ")").collect(Collectors.joining("; ")));
        return null;
    }

    private String toShortName(String lastName, String firstName) {
        if (firstName.isEmpty()) {
            return lastName + ", ";
        }
        int initialEnd = firstName.offsetByCodePoints(0, 1);
        return lastName + ", " + firstName.substring(0, initialEnd) + ".";
    }

    private String[] toKeywordArray(List<String> keywords) {
        if (CollUtil.isEmpty(keywords)) {
            return new String[0];
        }
        return keywords.stream()
                .filter(StrUtil::isNotBlank)
                .toArray(String[]::new);
    }

    @AllArgsConstructor
    private static class FullNameEntry {
        private final String fullName;
        private final String firstName;
        private final String id;
    }
}
