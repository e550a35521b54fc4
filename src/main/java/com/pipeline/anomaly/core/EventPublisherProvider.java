package com.pipeline.anomaly.core;

import com.pipeline.anomaly.model.TrainingConfig;

/**
 * 按训练配置创建事件发布器
 */
public interface EventPublisherProvider {

    /**
     * @return 事件发布器；未启用事件时返回null
     */
    EventPublisher forTraining(TrainingConfig training);
}
