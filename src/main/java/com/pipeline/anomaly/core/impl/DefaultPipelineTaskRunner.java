package com.pipeline.anomaly.core.impl;

import com.pipeline.anomaly.EngineConfig;
import com.pipeline.anomaly.core.ConfigurationStore;
import com.pipeline.anomaly.core.EventPublisher;
import com.pipeline.anomaly.core.EventPublisherProvider;
import com.pipeline.anomaly.core.ForecastingModel;
import com.pipeline.anomaly.core.ModelProvider;
import com.pipeline.anomaly.core.PipelineTaskRunner;
import com.pipeline.anomaly.core.ScorerManager;
import com.pipeline.anomaly.core.TimeSeriesStore;
import com.pipeline.anomaly.core.TimeSeriesStoreProvider;
import com.pipeline.anomaly.model.Pipeline;
import com.pipeline.anomaly.model.PipelineMode;
import com.pipeline.anomaly.model.TaskKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * 任务入口默认实现。
 *
 * 每次触发都重新读取管道配置、重新获取模型和存储句柄，执行器内不保留任何管道状态，
 * 不同管道或同一管道不同任务的并发触发互不影响。
 */
public class DefaultPipelineTaskRunner implements PipelineTaskRunner {

    private static final Logger log = LoggerFactory.getLogger(DefaultPipelineTaskRunner.class);

    private final ConfigurationStore configStore;
    private final ModelProvider modelProvider;
    private final TimeSeriesStoreProvider storeProvider;
    /** 可为null */
    private final EventPublisherProvider eventProvider;
    private final ScorerManager scorerManager;
    private final PortCallExecutor executor;
    /** 存储地址与训练后是否写回 model.id */
    private final EngineConfig config;
    private final Clock clock;

    public DefaultPipelineTaskRunner(ConfigurationStore configStore,
                                     ModelProvider modelProvider,
                                     TimeSeriesStoreProvider storeProvider,
                                     EventPublisherProvider eventProvider,
                                     ScorerManager scorerManager,
                                     PortCallExecutor executor,
                                     EngineConfig config,
                                     Clock clock) {
        this.configStore = configStore;
        this.modelProvider = modelProvider;
        this.storeProvider = storeProvider;
        this.eventProvider = eventProvider;
        this.scorerManager = scorerManager;
        this.executor = executor;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public void runTask(TaskKind kind, String pipelineName) {
        Pipeline pipeline = configStore.get(pipelineName);
        if (pipeline == null) {
            log.warn("Pipeline '{}' not found, {} task skipped.", pipelineName, kind);
            return;
        }
        PipelineValidator.validateOrThrow(pipeline);

        if (!pipeline.isEnabled()) {
            log.info("Pipeline '{}' is disabled, {} task skipped.", pipelineName, kind);
            return;
        }
        if (kind == TaskKind.FORECAST && pipeline.getMode() == PipelineMode.ANOMALY_ONLY) {
            log.info("Pipeline '{}' runs in {} mode, forecast task skipped.", pipelineName, pipeline.getMode());
            return;
        }
        if (kind == TaskKind.ANOMALY && pipeline.getMode() == PipelineMode.FORECAST_ONLY) {
            log.info("Pipeline '{}' runs in {} mode, anomaly task skipped.", pipelineName, pipeline.getMode());
            return;
        }

        Instant now = clock.instant();
        long startTime = System.currentTimeMillis();
        log.info("Starting {} task for pipeline '{}'.", kind, pipelineName);

        TimeSeriesStore store = storeProvider.forPipeline(pipeline,
                config.resolveReadUrl(pipeline), config.resolveWriteUrl(pipeline));
        ForecastingModel model = modelProvider.forPipeline(pipeline);
        switch (kind) {
            case FORECAST:
                new DefaultForecastLoop(store, model, executor).runForecast(pipeline, now);
                break;
            case ANOMALY: {
                DefaultForecastLoop forecastLoop = new DefaultForecastLoop(store, model, executor);
                new DefaultAnomalyEngine(store, model, forecastLoop, scorerManager, executor)
                        .runAnomalyCheck(pipeline, now);
                break;
            }
            case TRAINING:
                runTraining(pipeline, store, model, now);
                break;
            default:
                throw new IllegalArgumentException("Unknown task kind: " + kind);
        }

        log.info("{} task for pipeline '{}' completed in {}ms.",
                kind, pipelineName, System.currentTimeMillis() - startTime);
    }

    private void runTraining(Pipeline pipeline, TimeSeriesStore store, ForecastingModel model, Instant now) {
        EventPublisher publisher = (eventProvider != null) ? eventProvider.forTraining(pipeline.getTraining()) : null;
        String newModelId;
        try {
            newModelId = new DefaultTrainingLoop(store, model, executor, publisher, clock)
                    .runTraining(pipeline, now);
        } finally {
            if (publisher != null) {
                publisher.close();
            }
        }

        if (newModelId == null || Objects.equals(newModelId, pipeline.getModel().getId())) {
            return;
        }
        if (!config.isUpdateModelIdAfterTraining()) {
            log.info("Pipeline '{}': new model id {} not stored (update disabled).",
                    pipeline.getName(), newModelId);
            return;
        }
        storeModelId(pipeline.getName(), newModelId);
    }

    /**
     * 训练耗时期间配置可能已被修改或删除，重新读取最新配置后只更新 model.id
     */
    private void storeModelId(String pipelineName, String newModelId) {
        Pipeline latest = configStore.get(pipelineName);
        if (latest == null) {
            log.warn("Pipeline '{}' was deleted during training, new model id {} discarded.",
                    pipelineName, newModelId);
            return;
        }
        latest.getModel().setId(newModelId);
        configStore.save(latest);
        log.info("Pipeline '{}': model id updated to {}.", pipelineName, newModelId);
    }

    @Override
    public boolean checkModelHealth(String pipelineName) {
        try {
            Pipeline pipeline = configStore.get(pipelineName);
            if (pipeline == null) {
                log.warn("Pipeline '{}' not found, health check skipped.", pipelineName);
                return false;
            }
            ForecastingModel model = modelProvider.forPipeline(pipeline);
            Boolean healthy = executor.callModel("healthCheck", model::healthCheck);
            return Boolean.TRUE.equals(healthy);
        } catch (Exception e) {
            log.warn("Health check for pipeline '{}' failed: {}", pipelineName, e.getMessage());
            return false;
        }
    }
}
