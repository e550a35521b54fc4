package com.pipeline.anomaly.model;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 模型训练配置，包含训练调度、训练数据窗口以及训练事件发布设置
 */
public class TrainingConfig implements Serializable {
    private boolean enabled = true;
    /** 默认每日零点 */
    private String schedule = "0 0 * * *";
    /** 训练数据回看窗口 */
    private String window = "30d";
    /** 训练服务地址（远程模型） */
    private String endpoint;
    private Map<String, Object> parameters = new LinkedHashMap<>();

    // ---- 训练事件 ----
    private boolean eventsEnabled = false;
    private String eventBootstrapServers = "localhost:9092";
    private String eventTopic = "training-events";
    /** 消息键模板，支持 {pipeline_name} 占位符 */
    private String eventKeyTemplate = "{pipeline_name}";
    /** 自定义消息结构；为空时使用默认结构 */
    private Map<String, Object> eventMessageTemplate = new LinkedHashMap<>();

    public TrainingConfig() {}

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public String getSchedule() { return schedule; }
    public void setSchedule(String schedule) { this.schedule = schedule; }
    public String getWindow() { return window; }
    public void setWindow(String window) { this.window = window; }
    public String getEndpoint() { return endpoint; }
    public void setEndpoint(String endpoint) { this.endpoint = endpoint; }
    public Map<String, Object> getParameters() { return parameters; }
    public void setParameters(Map<String, Object> parameters) {
        this.parameters = (parameters != null) ? parameters : new LinkedHashMap<>();
    }
    public boolean isEventsEnabled() { return eventsEnabled; }
    public void setEventsEnabled(boolean eventsEnabled) { this.eventsEnabled = eventsEnabled; }
    public String getEventBootstrapServers() { return eventBootstrapServers; }
    public void setEventBootstrapServers(String eventBootstrapServers) { this.eventBootstrapServers = eventBootstrapServers; }
    public String getEventTopic() { return eventTopic; }
    public void setEventTopic(String eventTopic) { this.eventTopic = eventTopic; }
    public String getEventKeyTemplate() { return eventKeyTemplate; }
    public void setEventKeyTemplate(String eventKeyTemplate) { this.eventKeyTemplate = eventKeyTemplate; }
    public Map<String, Object> getEventMessageTemplate() { return eventMessageTemplate; }
    public void setEventMessageTemplate(Map<String, Object> eventMessageTemplate) {
        this.eventMessageTemplate = (eventMessageTemplate != null) ? eventMessageTemplate : new LinkedHashMap<>();
    }
}
