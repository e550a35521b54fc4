package com.pipeline.anomaly.event;

import com.pipeline.anomaly.model.TrainingConfig;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 训练生命周期事件消息构造。
 *
 * 未配置消息模板时输出默认结构：
 *   {event_type, timestamp, pipeline_name, ...上下文}
 * 配置了模板时，模板中字符串值里的 {var} 用上下文替换，非字符串值原样保留，
 * 模板未覆盖的上下文字段追加在后面。未知占位符保持原样。
 */
public final class TrainingEvents {

    public static final String STARTED = "training_started";
    public static final String COMPLETED = "training_completed";
    public static final String FAILED = "training_failed";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z0-9_]+)}");

    private TrainingEvents() {}

    public static Map<String, Object> buildMessage(TrainingConfig training, String pipelineName,
                                                   String eventType, Map<String, Object> context,
                                                   Instant timestamp) {
        Map<String, Object> template = training.getEventMessageTemplate();
        if (template == null || template.isEmpty()) {
            Map<String, Object> message = new LinkedHashMap<>();
            message.put("event_type", eventType);
            message.put("timestamp", timestamp.truncatedTo(ChronoUnit.MILLIS).toString());
            message.put("pipeline_name", pipelineName);
            message.putAll(context);
            return message;
        }

        Map<String, Object> vars = new LinkedHashMap<>(context);
        vars.put("event_type", eventType);
        vars.put("pipeline_name", pipelineName);

        Map<String, Object> message = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : template.entrySet()) {
            Object value = e.getValue();
            message.put(e.getKey(), value instanceof String ? substitute((String) value, vars) : value);
        }
        for (Map.Entry<String, Object> e : context.entrySet()) {
            message.putIfAbsent(e.getKey(), e.getValue());
        }
        return message;
    }

    /**
     * 消息键，由键模板替换 {pipeline_name} 得到
     */
    public static String messageKey(TrainingConfig training, String pipelineName) {
        String template = training.getEventKeyTemplate();
        if (template == null || template.isEmpty()) {
            return null;
        }
        Map<String, Object> vars = new LinkedHashMap<>();
        vars.put("pipeline_name", pipelineName);
        return substitute(template, vars);
    }

    static String substitute(String template, Map<String, Object> vars) {
        Matcher m = PLACEHOLDER.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String key = m.group(1);
            String replacement = vars.containsKey(key) ? String.valueOf(vars.get(key)) : m.group();
            m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
