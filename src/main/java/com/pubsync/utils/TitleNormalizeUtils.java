package com.pubsync.utils;

import cn.hutool.core.util.StrUtil;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 标题规范化工具类
 * 仅用作查重比较键,不对用户展示
 *
 * @author 席崇援
 */
public final class TitleNormalizeUtils {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private TitleNormalizeUtils() {}

    /**
     * 转小写、折叠连续空白、去首尾空白
     *
     * @param title 原始标题,可为 null
     * @return 规范化标题,null 返回空串
     */
    public static String normalize(String title) {
        if (title == null) {
            return StrUtil.EMPTY;
        }
        return WHITESPACE.matcher(title.toLowerCase(Locale.ROOT)).replaceAll(" ").strip();
    }
}
