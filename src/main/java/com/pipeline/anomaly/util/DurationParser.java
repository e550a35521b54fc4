package com.pipeline.anomaly.util;

import com.pipeline.anomaly.exception.InvalidDurationException;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 紧凑时长字符串解析器。
 *
 * 格式为一个或多个数字后跟单个单位字符（s/m/h/d），例如 "30s"、"1h"、"30d"。
 * 不支持小数、复合时长（"1h30m"）和本地化写法，与已存储的管道配置保持兼容。
 */
public final class DurationParser {

    private static final Pattern DURATION = Pattern.compile("^(\\d+)([smhd])$");

    private DurationParser() {}

    /**
     * 解析为秒数
     *
     * @throws InvalidDurationException 空串、缺少或未知单位、数值部分非数字、数值溢出
     */
    public static long parseSeconds(String value) {
        if (value == null || value.isEmpty()) {
            throw new InvalidDurationException(String.valueOf(value), "empty duration");
        }
        Matcher m = DURATION.matcher(value);
        if (!m.matches()) {
            throw new InvalidDurationException(value,
                    "expected <digits><unit> with unit one of s, m, h, d");
        }
        try {
            long magnitude = Long.parseLong(m.group(1));
            return Math.multiplyExact(magnitude, unitSeconds(m.group(2).charAt(0)));
        } catch (NumberFormatException | ArithmeticException e) {
            throw new InvalidDurationException(value, "magnitude out of range");
        }
    }

    public static boolean isValid(String value) {
        try {
            parseSeconds(value);
            return true;
        } catch (InvalidDurationException e) {
            return false;
        }
    }

    /**
     * 单位对应的秒数
     */
    public static long unitSeconds(char unit) {
        switch (unit) {
            case 's': return 1L;
            case 'm': return 60L;
            case 'h': return 3600L;
            case 'd': return 86400L;
            default:
                throw new IllegalArgumentException("Unknown duration unit: " + unit);
        }
    }
}
