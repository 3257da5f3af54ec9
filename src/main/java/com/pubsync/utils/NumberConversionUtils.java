package com.pubsync.utils;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;

/**
 * 数字转换工具类
 * 使用 Apache Commons Lang NumberUtils 替代手写解析逻辑
 *
 * 功能：
 * - 安全地将表格单元格文本转换为 Integer(兼容 "2024"、"2024.0" 等写法)
 * - 提供默认值fallback
 * - 不抛出异常，返回 null 或默认值
 *
 * @author 席崇援
 */
@Slf4j
public class NumberConversionUtils {

    private NumberConversionUtils() {}

    /**
     * 将字符串转换为 Integer
     *
     * @param input 输入字符串
     * @return Integer 值，失败返回 null
     */
    public static Integer toInteger(String input) {
        return toInteger(input, null);
    }

    /**
     * 将字符串转换为 Integer（带默认值）
     *
     * @param input        输入字符串
     * @param defaultValue 默认值
     * @return Integer 值，失败返回默认值
     */
    public static Integer toInteger(String input, Integer defaultValue) {
        if (StringUtils.isBlank(input)) {
            return defaultValue;
        }

        String trimmed = input.trim();

        if (NumberUtils.isDigits(trimmed)) {
            try {
                return Integer.parseInt(trimmed);
            } catch (NumberFormatException e) {
                log.warn("整数超出范围: {}", trimmed);
                return defaultValue;
            }
        }

        // CSV/Excel 中的年份可能被写成浮点数
        if (NumberUtils.isCreatable(trimmed)) {
            try {
                Number number = NumberUtils.createNumber(trimmed);
                if (number.doubleValue() == Math.floor(number.doubleValue())) {
                    return number.intValue();
                }
            } catch (Exception e) {
                log.warn("整数解析失败: {}", trimmed, e);
            }
        }

        log.warn("无法转换为 Integer: {}", input);
        return defaultValue;
    }
}
