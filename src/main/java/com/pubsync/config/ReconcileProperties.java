package com.pubsync.config;

import com.pubsync.model.dto.ReconcileOptionsDTO;
import com.pubsync.model.enums.DuplicateMatchPolicy;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * 对账任务配置
 *
 * @author 席崇援
 * @since 2025-11-02
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "reconcile")
public class ReconcileProperties {

    /**
     * 标题模糊匹配阈值(0-100)
     */
    @NotNull(message = "相似度阈值不能为空")
    @Min(value = 0, message = "相似度阈值不能小于0")
    @Max(value = 100, message = "相似度阈值不能大于100")
    private Integer threshold = 90;

    /**
     * 年份过滤,为空表示不过滤
     */
    private List<Integer> years = new ArrayList<>();

    /**
     * 机构关键词(大小写不敏感的子串)
     */
    private List<String> affiliationKeywords = new ArrayList<>(List.of(
            "Khazar University",
            "Khazar",
            "Xəzər Universiteti"
    ));

    /**
     * 机构排除关键词,命中后该作者块不计入
     */
    private List<String> affiliationExcludeKeywords = new ArrayList<>();

    /**
     * 标题排除子串(更正、勘误等)
     */
    private List<String> titleExcludeKeywords = new ArrayList<>(List.of(
            "Correction:",
            "Correction to:",
            "Erratum to",
            "Corrigendum to",
            "<FOR VERIFICATION>"
    ));

    /**
     * 重复判定策略
     */
    private DuplicateMatchPolicy matchPolicy = DuplicateMatchPolicy.FIRST_MATCH;

    /**
     * 需人工复核的院系单元格底色(RGB 十六进制)
     */
    @NotBlank(message = "高亮颜色不能为空")
    private String highlightColor = "FFFF00";

    /**
     * 输入文件配置
     */
    private InputConfig input = new InputConfig();

    /**
     * 输出目录
     */
    private String outputDir = "./output";

    @Data
    public static class InputConfig {
        /**
         * Scopus 导出文件
         */
        private String sourceFile;

        /**
         * United 论文库文件
         */
        private String referenceFile;

        /**
         * United 文件中的工作表名称
         */
        private String referenceSheet = "Last";

        /**
         * 作者-院系对照表(可选)
         */
        private String departmentFile;
    }

    /**
     * 转换为单次对账使用的不可变参数
     */
    public ReconcileOptionsDTO toOptions() {
        return ReconcileOptionsDTO.builder()
                .threshold(threshold)
                .years(years == null ? null : new LinkedHashSet<>(years))
                .titleExcludeKeywords(titleExcludeKeywords)
                .affiliationKeywords(affiliationKeywords)
                .affiliationExcludeKeywords(affiliationExcludeKeywords)
                .matchPolicy(matchPolicy)
                .build();
    }
}
