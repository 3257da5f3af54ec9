package com.pubsync.model.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;

/**
 * Excel 导出结果
 *
 * @author 席崇援
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExportResultVO {

    /**
     * 是否成功
     */
    private Boolean success;

    /**
     * 写出的文件
     */
    private Path file;

    /**
     * 写出的数据行数
     */
    private Integer rowCount;

    /**
     * 高亮的行数
     */
    private Integer highlightedCount;

    /**
     * 失败原因
     */
    private String message;

    public static ExportResultVO success(Path file, int rowCount, int highlightedCount) {
        return ExportResultVO.builder()
                .success(true)
                .file(file)
                .rowCount(rowCount)
                .highlightedCount(highlightedCount)
                .message("导出成功")
                .build();
    }

    public static ExportResultVO failure(String message) {
        return ExportResultVO.builder()
                .success(false)
                .rowCount(0)
                .highlightedCount(0)
                .message(message)
                .build();
    }
}
