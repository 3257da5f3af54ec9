package com.pubsync.service;

import com.pubsync.model.vo.ExtractedAuthorsVO;

import java.util.List;

/**
 * 本机构作者提取服务
 *
 * @author 席崇援
 */
public interface AffiliationAuthorService {

    /**
     * 从作者-机构字符串中提取属于目标机构的作者
     *
     * @param authorsWithAffiliations "LastName, FirstName, affiliation; ..."
     * @param authorFullNames         "LastName, FirstName (ID); ..."
     * @param keywords                机构关键词(大小写不敏感子串)
     * @return 提取结果
     */
    default ExtractedAuthorsVO extract(String authorsWithAffiliations, String authorFullNames,
                                       List<String> keywords) {
        return extract(authorsWithAffiliations, authorFullNames, keywords, List.of());
    }

    /**
     * 从作者-机构字符串中提取属于目标机构的作者
     *
     * @param authorsWithAffiliations "LastName, FirstName, affiliation; ..."
     * @param authorFullNames         "LastName, FirstName (ID); ..."
     * @param keywords                机构关键词(大小写不敏感子串)
     * @param excludeKeywords         机构排除关键词,命中的作者块不计入
     * @return 提取结果
     */
    ExtractedAuthorsVO extract(String authorsWithAffiliations, String authorFullNames,
                               List<String> keywords, List<String> excludeKeywords);
}
