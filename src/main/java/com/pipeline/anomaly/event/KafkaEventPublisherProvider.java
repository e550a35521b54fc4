package com.pipeline.anomaly.event;

import com.pipeline.anomaly.core.EventPublisher;
import com.pipeline.anomaly.core.EventPublisherProvider;
import com.pipeline.anomaly.model.TrainingConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 每次训练任务创建一个Kafka发布器，由调用方负责关闭。
 * 管道未指定broker时使用全局默认地址。
 */
public class KafkaEventPublisherProvider implements EventPublisherProvider {

    private static final Logger log = LoggerFactory.getLogger(KafkaEventPublisherProvider.class);

    private final String defaultBootstrapServers;

    public KafkaEventPublisherProvider(String defaultBootstrapServers) {
        this.defaultBootstrapServers = defaultBootstrapServers;
    }

    @Override
    public EventPublisher forTraining(TrainingConfig training) {
        if (training == null || !training.isEventsEnabled()) {
            return null;
        }
        String servers = training.getEventBootstrapServers();
        if (servers == null || servers.isBlank()) {
            servers = defaultBootstrapServers;
        }
        try {
            return new KafkaEventPublisher(servers);
        } catch (Exception e) {
            log.warn("Failed to create event publisher for {}: {}. Continuing without events.",
                    servers, e.getMessage());
            return null;
        }
    }
}
