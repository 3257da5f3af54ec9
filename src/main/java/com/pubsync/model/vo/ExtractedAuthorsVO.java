package com.pubsync.model.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 本机构作者提取结果
 * 三个列表按作者块出现顺序一一对应
 *
 * @author 席崇援
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractedAuthorsVO {

    public static final String SEPARATOR = "; ";

    /**
     * 短名: "LastName, F."
     */
    @Builder.Default
    private List<String> shortNames = new ArrayList<>();

    /**
     * 全名及 ID: "LastName, FirstName (ID)"
     */
    @Builder.Default
    private List<String> fullNamesWithIds = new ArrayList<>();

    /**
     * 全名: "LastName, FirstName"
     */
    @Builder.Default
    private List<String> fullNames = new ArrayList<>();

    /**
     * 同姓多人且无法按名字区分、因此未附加 ID 的作者
     */
    @Builder.Default
    private List<String> ambiguousAuthors = new ArrayList<>();

    public static ExtractedAuthorsVO empty() {
        return ExtractedAuthorsVO.builder().build();
    }

    public int getCount() {
        return shortNames.size();
    }

    public String getAuthorsShort() {
        return String.join(SEPARATOR, shortNames);
    }

    public String getAuthorsWithIds() {
        return String.join(SEPARATOR, fullNamesWithIds);
    }

    public String getAuthorsFull() {
        return String.join(SEPARATOR, fullNames);
    }
}
