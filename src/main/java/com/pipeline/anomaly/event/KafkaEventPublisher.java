package com.pipeline.anomaly.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.pipeline.anomaly.core.EventPublisher;
import com.pipeline.anomaly.util.JsonSupport;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Properties;

/**
 * Kafka事件发布器，用于训练生命周期事件。
 *
 * 消息体为JSON字符串。发布是尽力而为的：序列化失败、发送失败都只记录日志，
 * 不影响训练周期本身。
 */
public class KafkaEventPublisher implements EventPublisher {

    private static final Logger log = LoggerFactory.getLogger(KafkaEventPublisher.class);

    static final String CLIENT_ID = "openanomaly-training";
    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(10);

    private final Producer<String, String> producer;

    public KafkaEventPublisher(String bootstrapServers) {
        this(new KafkaProducer<>(producerProperties(bootstrapServers)));
        log.info("KafkaEventPublisher connected to {}", bootstrapServers);
    }

    public KafkaEventPublisher(Producer<String, String> producer) {
        this.producer = producer;
    }

    static Properties producerProperties(String bootstrapServers) {
        Properties props = new Properties();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.CLIENT_ID_CONFIG, CLIENT_ID);
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.RETRIES_CONFIG, 3);
        props.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, 1);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        return props;
    }

    @Override
    public void publish(String topic, Map<String, Object> message, String key) {
        try {
            String json = JsonSupport.mapper().writeValueAsString(message);
            producer.send(new ProducerRecord<>(topic, key, json), (metadata, e) -> {
                if (e != null) {
                    log.error("Message delivery to topic '{}' failed: {}", topic, e.getMessage());
                } else {
                    log.debug("Message delivered to {} [{}]", metadata.topic(), metadata.partition());
                }
            });
            log.info("Published message to topic '{}' with key '{}'", topic, key);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize event for topic '{}': {}", topic, e.getMessage());
        } catch (Exception e) {
            log.error("Unexpected error publishing to topic '{}': {}", topic, e.getMessage(), e);
        }
    }

    @Override
    public void flush() {
        try {
            producer.flush();
        } catch (Exception e) {
            log.warn("Flushing event producer failed: {}", e.getMessage());
        }
    }

    @Override
    public void close() {
        try {
            producer.close(CLOSE_TIMEOUT);
        } catch (Exception e) {
            log.warn("Closing event producer failed: {}", e.getMessage());
        }
    }
}
