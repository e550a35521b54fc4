package com.pipeline.anomaly.util;

import org.quartz.CronExpression;

import java.util.ArrayList;
import java.util.List;

/**
 * 5段cron表达式（分 时 日 月 周）与Quartz表达式之间的转换。
 *
 * Quartz要求秒字段，且日与周两个字段必须有一个是 '?'；
 * 周字段的数字 0-7（0和7均为周日）映射为Quartz的 1-7。
 * 同时限定日和周的表达式不被接受。
 */
public final class CronSchedules {

    private CronSchedules() {}

    public static boolean isValid(String cron) {
        try {
            toQuartz(cron);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * @throws IllegalArgumentException 表达式不是合法的5段cron
     */
    public static String toQuartz(String cron) {
        if (cron == null || cron.trim().isEmpty()) {
            throw new IllegalArgumentException("Cron expression is empty");
        }
        String[] f = cron.trim().split("\\s+");
        if (f.length != 5) {
            throw new IllegalArgumentException("Cron expression must have 5 fields, got "
                    + f.length + ": '" + cron + "'");
        }
        String minute = f[0];
        String hour = f[1];
        String dom = f[2];
        String month = f[3];
        String dow = f[4];

        boolean domRestricted = !"*".equals(dom) && !"?".equals(dom);
        boolean dowRestricted = !"*".equals(dow) && !"?".equals(dow);
        if (domRestricted && dowRestricted) {
            throw new IllegalArgumentException(
                    "Restricting both day-of-month and day-of-week is not supported: '" + cron + "'");
        }

        String quartzDom;
        String quartzDow;
        if (dowRestricted) {
            quartzDom = "?";
            quartzDow = mapDayOfWeek(dow);
        } else {
            quartzDom = "?".equals(dom) ? "*" : dom;
            quartzDow = "?";
        }

        String expr = "0 " + minute + " " + hour + " " + quartzDom + " " + month + " " + quartzDow;
        if (!CronExpression.isValidExpression(expr)) {
            throw new IllegalArgumentException("Invalid cron expression: '" + cron + "'");
        }
        return expr;
    }

    /**
     * 周字段映射。数字范围展开为列表，名称（MON-FRI）原样保留。
     */
    private static String mapDayOfWeek(String dow) {
        List<String> out = new ArrayList<>();
        for (String part : dow.split(",")) {
            if (part.isEmpty()) {
                throw new IllegalArgumentException("Empty day-of-week element in '" + dow + "'");
            }
            String range = part;
            int stepValue = 1;
            int slash = part.indexOf('/');
            if (slash >= 0) {
                range = part.substring(0, slash);
                stepValue = parseDay(part.substring(slash + 1), 1, 7);
            }

            if (!isNumericRange(range)) {
                if (slash >= 0) {
                    throw new IllegalArgumentException("Unsupported day-of-week step: '" + part + "'");
                }
                out.add(part);
                continue;
            }

            int from;
            int to;
            if ("*".equals(range)) {
                from = 0;
                to = 6;
            } else if (range.contains("-")) {
                String[] bounds = range.split("-", 2);
                from = parseDay(bounds[0], 0, 7);
                to = parseDay(bounds[1], 0, 7);
                if (from > to) {
                    throw new IllegalArgumentException("Descending day-of-week range: '" + part + "'");
                }
            } else {
                from = parseDay(range, 0, 7);
                to = (slash >= 0) ? 6 : from;
            }
            for (int d = from; d <= to; d += stepValue) {
                String q = String.valueOf((d % 7) + 1);
                if (!out.contains(q)) {
                    out.add(q);
                }
            }
        }
        return String.join(",", out);
    }

    private static boolean isNumericRange(String s) {
        return "*".equals(s) || s.matches("\\d+(-\\d+)?");
    }

    private static int parseDay(String s, int min, int max) {
        try {
            int v = Integer.parseInt(s);
            if (v < min || v > max) {
                throw new IllegalArgumentException("Day-of-week value out of range: " + s);
            }
            return v;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid day-of-week value: " + s, e);
        }
    }
}
