package com.pipeline.anomaly.util;

import com.pipeline.anomaly.model.MetricId;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 序列标识编解码：name{k1="v1",k2="v2"}。
 *
 * 编码时标签按键排序，保证同一组标签总是得到同一个字符串；无标签时只输出名称。
 * 这是时序存储与引擎之间、引擎与输出序列之间交换序列身份的唯一格式。
 */
public final class MetricIdCodec {

    private MetricIdCodec() {}

    public static String encode(String name, Map<String, String> labels) {
        if (labels == null || labels.isEmpty()) {
            return name;
        }
        StringBuilder sb = new StringBuilder(name).append('{');
        boolean first = true;
        for (Map.Entry<String, String> e : new TreeMap<>(labels).entrySet()) {
            if (!first) {
                sb.append(',');
            }
            sb.append(e.getKey()).append("=\"").append(escape(e.getValue())).append('"');
            first = false;
        }
        return sb.append('}').toString();
    }

    public static String encode(MetricId id) {
        return encode(id.getName(), id.getLabels());
    }

    /**
     * 解码。容忍无标签的裸名称；没有 '=' 的标签片段被忽略。
     */
    public static MetricId decode(String seriesId) {
        if (seriesId == null) {
            throw new IllegalArgumentException("Series identifier must not be null");
        }
        int brace = seriesId.indexOf('{');
        if (brace < 0) {
            return new MetricId(seriesId.trim(), new LinkedHashMap<>());
        }
        String name = seriesId.substring(0, brace).trim();
        String body = seriesId.substring(brace + 1);
        if (body.endsWith("}")) {
            body = body.substring(0, body.length() - 1);
        }

        Map<String, String> labels = new LinkedHashMap<>();
        for (String pair : splitTopLevel(body)) {
            int eq = pair.indexOf('=');
            if (eq < 0) {
                continue;
            }
            String key = pair.substring(0, eq).trim();
            if (key.isEmpty()) {
                continue;
            }
            labels.put(key, unquote(pair.substring(eq + 1).trim()));
        }
        return new MetricId(name, labels);
    }

    /**
     * 按不在引号内的逗号切分
     */
    private static List<String> splitTopLevel(String body) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuotes = false;
        boolean escaped = false;
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (escaped) {
                current.append(c);
                escaped = false;
            } else if (c == '\\') {
                current.append(c);
                escaped = true;
            } else if (c == '"') {
                current.append(c);
                inQuotes = !inQuotes;
            } else if (c == ',' && !inQuotes) {
                parts.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        if (current.length() > 0) {
            parts.add(current.toString());
        }
        return parts;
    }

    private static String unquote(String raw) {
        String v = raw;
        if (v.length() >= 2 && v.startsWith("\"") && v.endsWith("\"")) {
            v = v.substring(1, v.length() - 1);
        }
        return unescape(v);
    }

    private static String escape(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\': sb.append("\\\\"); break;
                case '"': sb.append("\\\""); break;
                case '\n': sb.append("\\n"); break;
                default: sb.append(c);
            }
        }
        return sb.toString();
    }

    private static String unescape(String value) {
        if (value.indexOf('\\') < 0) {
            return value;
        }
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\\' && i + 1 < value.length()) {
                char next = value.charAt(++i);
                sb.append(next == 'n' ? '\n' : next);
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
