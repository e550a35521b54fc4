package com.pipeline.anomaly.core.impl;

import com.pipeline.anomaly.model.Pipeline;
import com.pipeline.anomaly.util.MetricIdCodec;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 输出序列命名：
 * {prefix}{pipeline}_forecast{pipeline="..",source="..",type="mean"|quantile=".."}
 * {prefix}{pipeline}_anomaly{pipeline="..",source="..",type="anomaly_score"|"is_anomaly"}
 */
final class ResultSeriesNames {

    static final String TYPE_MEAN = "mean";
    static final String TYPE_ANOMALY_SCORE = "anomaly_score";
    static final String TYPE_IS_ANOMALY = "is_anomaly";

    private ResultSeriesNames() {}

    static String forecastMean(Pipeline pipeline) {
        Map<String, String> labels = baseLabels(pipeline);
        labels.put("type", TYPE_MEAN);
        return MetricIdCodec.encode(metricName(pipeline, "_forecast"), labels);
    }

    static String forecastQuantile(Pipeline pipeline, double level) {
        Map<String, String> labels = baseLabels(pipeline);
        labels.put("quantile", formatLevel(level));
        return MetricIdCodec.encode(metricName(pipeline, "_forecast"), labels);
    }

    static String anomaly(Pipeline pipeline, String type) {
        Map<String, String> labels = baseLabels(pipeline);
        labels.put("type", type);
        return MetricIdCodec.encode(metricName(pipeline, "_anomaly"), labels);
    }

    /** 聚合算子与修饰关键字，不作为指标名 */
    private static final Set<String> KEYWORDS = new HashSet<>(Arrays.asList(
            "sum", "avg", "min", "max", "count", "stddev", "stdvar", "topk", "bottomk", "quantile",
            "count_values", "group", "limitk", "limit_ratio",
            "by", "without", "on", "ignoring", "group_left", "group_right",
            "offset", "bool", "and", "or", "unless", "inf", "nan"));

    /** 其后跟随标签列表的关键字 */
    private static final Set<String> GROUPING = new HashSet<>(Arrays.asList(
            "by", "without", "on", "ignoring", "group_left", "group_right"));

    /**
     * 从查询表达式中取出第一个指标名：跳过函数名、聚合关键字、分组标签列表、
     * 标签选择器、区间、字符串与数字字面量。
     * 例如 rate(x{job="a"}[5m]) 得到 x；找不到指标名时返回空串。
     */
    static String sourceName(String query) {
        if (query == null) {
            return "";
        }
        int n = query.length();
        int i = 0;
        while (i < n) {
            char c = query.charAt(i);
            if (c == '"' || c == '\'' || c == '`') {
                i = skipQuoted(query, i);
            } else if (c == '{') {
                i = skipGroup(query, i, '{', '}');
            } else if (c == '[') {
                i = skipGroup(query, i, '[', ']');
            } else if (Character.isDigit(c) || (c == '.' && i + 1 < n && Character.isDigit(query.charAt(i + 1)))) {
                i = skipWord(query, i);
            } else if (isNameStart(c)) {
                int end = skipWord(query, i);
                String word = query.substring(i, end);
                int next = skipSpaces(query, end);
                i = end;
                if (next < n && query.charAt(next) == '(') {
                    if (GROUPING.contains(word.toLowerCase(Locale.ROOT))) {
                        i = skipGroup(query, next, '(', ')');
                    }
                    continue;
                }
                String lower = word.toLowerCase(Locale.ROOT);
                if ("offset".equals(lower)) {
                    i = skipWord(query, next);
                } else if (!KEYWORDS.contains(lower)) {
                    return word;
                }
            } else {
                i++;
            }
        }
        return "";
    }

    private static boolean isNameStart(char c) {
        return Character.isLetter(c) || c == '_' || c == ':';
    }

    private static int skipWord(String s, int i) {
        while (i < s.length()) {
            char c = s.charAt(i);
            if (!(Character.isLetterOrDigit(c) || c == '_' || c == ':' || c == '.')) {
                break;
            }
            i++;
        }
        return i;
    }

    private static int skipSpaces(String s, int i) {
        while (i < s.length() && Character.isWhitespace(s.charAt(i))) {
            i++;
        }
        return i;
    }

    /** 返回闭合引号之后的位置 */
    private static int skipQuoted(String s, int i) {
        char quote = s.charAt(i);
        i++;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c == '\\' && quote != '`') {
                i += 2;
                continue;
            }
            i++;
            if (c == quote) {
                break;
            }
        }
        return i;
    }

    /** 返回配对的闭合符号之后的位置，内部字符串中的括号不计入 */
    private static int skipGroup(String s, int i, char open, char close) {
        int depth = 0;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c == '"' || c == '\'' || c == '`') {
                i = skipQuoted(s, i);
                continue;
            }
            i++;
            if (c == open) {
                depth++;
            } else if (c == close && --depth == 0) {
                break;
            }
        }
        return i;
    }

    static String formatLevel(double level) {
        return BigDecimal.valueOf(level).stripTrailingZeros().toPlainString();
    }

    private static String metricName(Pipeline pipeline, String suffix) {
        String prefix = pipeline.getOutput() != null ? pipeline.getOutput().getMetricPrefix() : "";
        return (prefix != null ? prefix : "") + pipeline.getName() + suffix;
    }

    private static Map<String, String> baseLabels(Pipeline pipeline) {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put("pipeline", pipeline.getName());
        labels.put("source", sourceName(pipeline.getQuery()));
        return labels;
    }
}
