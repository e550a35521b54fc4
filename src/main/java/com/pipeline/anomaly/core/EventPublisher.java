package com.pipeline.anomaly.core;

import java.util.Map;

/**
 * 事件发布端口（可选）。尽力而为，发布失败只记录日志，不向调用方抛出。
 */
public interface EventPublisher extends AutoCloseable {

    /**
     * @param topic   主题
     * @param message 消息体
     * @param key     消息键，可为null
     */
    void publish(String topic, Map<String, Object> message, String key);

    void flush();

    @Override
    void close();
}
