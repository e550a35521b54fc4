package com.pipeline.anomaly.core.impl;

import com.pipeline.anomaly.core.EventPublisher;
import com.pipeline.anomaly.core.ForecastingModel;
import com.pipeline.anomaly.core.TimeSeriesStore;
import com.pipeline.anomaly.core.TrainingLoop;
import com.pipeline.anomaly.event.TrainingEvents;
import com.pipeline.anomaly.model.Pipeline;
import com.pipeline.anomaly.model.TimeSeriesRow;
import com.pipeline.anomaly.model.TrainingConfig;
import com.pipeline.anomaly.util.DurationParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 训练循环默认实现。
 *
 * 拉取 [now − 训练窗口, now] 的历史数据交给模型训练，返回新模型标识。
 * 训练失败原样抛出；可选地向事件总线发布开始、完成、失败事件，
 * 事件发布失败不影响训练结果。
 */
public class DefaultTrainingLoop implements TrainingLoop {

    private static final Logger log = LoggerFactory.getLogger(DefaultTrainingLoop.class);

    private final TimeSeriesStore store;
    private final ForecastingModel model;
    private final PortCallExecutor executor;
    /** 可为null，表示不发布事件 */
    private final EventPublisher publisher;
    private final Clock clock;

    public DefaultTrainingLoop(TimeSeriesStore store, ForecastingModel model, PortCallExecutor executor) {
        this(store, model, executor, null, Clock.systemUTC());
    }

    public DefaultTrainingLoop(TimeSeriesStore store, ForecastingModel model, PortCallExecutor executor,
                               EventPublisher publisher, Clock clock) {
        this.store = store;
        this.model = model;
        this.executor = executor;
        this.publisher = publisher;
        this.clock = clock;
    }

    @Override
    public String runTraining(Pipeline pipeline) {
        return runTraining(pipeline, clock.instant());
    }

    @Override
    public String runTraining(Pipeline pipeline, Instant now) {
        TrainingConfig training = pipeline.getTraining();
        String name = pipeline.getName();
        if (training == null || !training.isEnabled()) {
            log.debug("Pipeline '{}': training not configured or disabled.", name);
            return null;
        }

        Instant start = now.minusSeconds(DurationParser.parseSeconds(training.getWindow()));
        String currentModelId = pipeline.getModel().getId();

        Map<String, Object> startedContext = new LinkedHashMap<>();
        startedContext.put("model_id", currentModelId);
        startedContext.put("training_window", training.getWindow());
        emit(pipeline, TrainingEvents.STARTED, startedContext, false);

        long startedAt = clock.millis();
        try {
            List<TimeSeriesRow> rows = executor.callStore("queryRange",
                    () -> store.queryRange(pipeline.getQuery(), start, now, pipeline.getStep()));
            if (rows == null || rows.isEmpty()) {
                log.warn("Pipeline '{}': no training data in [{}, {}], skipping training.", name, start, now);
                return null;
            }

            log.info("Pipeline '{}': training on {} rows from {} to {}.", name, rows.size(), start, now);
            String newModelId = executor.callModel("train",
                    () -> model.train(rows, training.getParameters()));

            if (newModelId != null) {
                log.info("Pipeline '{}' trained. New model id: {}", name, newModelId);
                Map<String, Object> completed = new LinkedHashMap<>();
                completed.put("model_id", newModelId);
                completed.put("training_window", training.getWindow());
                completed.put("status", "success");
                completed.put("duration_seconds", elapsedSeconds(startedAt));
                emit(pipeline, TrainingEvents.COMPLETED, completed, true);
            } else {
                log.warn("Pipeline '{}': model returned no identifier after training.", name);
            }
            return newModelId;

        } catch (RuntimeException e) {
            log.error("Pipeline '{}': training failed: {}", name, e.getMessage(), e);
            Map<String, Object> failed = new LinkedHashMap<>();
            failed.put("model_id", currentModelId);
            failed.put("training_window", training.getWindow());
            failed.put("status", "failed");
            failed.put("duration_seconds", elapsedSeconds(startedAt));
            failed.put("error", String.valueOf(e.getMessage()));
            emit(pipeline, TrainingEvents.FAILED, failed, true);
            throw e;
        }
    }

    private void emit(Pipeline pipeline, String eventType, Map<String, Object> context, boolean flush) {
        if (publisher == null) {
            return;
        }
        TrainingConfig training = pipeline.getTraining();
        try {
            Map<String, Object> message = TrainingEvents.buildMessage(
                    training, pipeline.getName(), eventType, context, clock.instant());
            publisher.publish(training.getEventTopic(), message,
                    TrainingEvents.messageKey(training, pipeline.getName()));
            if (flush) {
                publisher.flush();
            }
        } catch (RuntimeException e) {
            log.warn("Pipeline '{}': failed to publish {} event: {}",
                    pipeline.getName(), eventType, e.getMessage());
        }
    }

    private double elapsedSeconds(long startedAt) {
        return Math.round((clock.millis() - startedAt) / 10.0) / 100.0;
    }
}
