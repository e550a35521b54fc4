package com.pipeline.anomaly.core.impl;

import com.pipeline.anomaly.exception.ConfigurationException;
import com.pipeline.anomaly.model.AnomalyConfig;
import com.pipeline.anomaly.model.CovariateConfig;
import com.pipeline.anomaly.model.ModelConfig;
import com.pipeline.anomaly.model.ModelType;
import com.pipeline.anomaly.model.Pipeline;
import com.pipeline.anomaly.model.SeriesType;
import com.pipeline.anomaly.model.TrainingConfig;
import com.pipeline.anomaly.model.ValidationResult;
import com.pipeline.anomaly.util.CronSchedules;
import com.pipeline.anomaly.util.DurationParser;

/**
 * 管道配置校验。收集全部错误后一次性返回，不在第一个错误处中断。
 */
public final class PipelineValidator {

    private PipelineValidator() {}

    public static ValidationResult validate(Pipeline pipeline) {
        ValidationResult result = new ValidationResult();
        if (pipeline == null) {
            result.addError("pipeline", "must not be null");
            return result;
        }

        if (isBlank(pipeline.getName())) {
            result.addError("name", "is required");
        }
        if (isBlank(pipeline.getQuery())) {
            result.addError("query", "is required");
        }
        if (pipeline.getMode() == null) {
            result.addError("mode", "is required");
        }

        boolean stepOk = checkDuration(result, "step", pipeline.getStep());
        checkDuration(result, "context_window", pipeline.getContextWindow());
        boolean horizonOk = checkDuration(result, "prediction_horizon", pipeline.getPredictionHorizon());
        if (stepOk && horizonOk) {
            long step = DurationParser.parseSeconds(pipeline.getStep());
            long horizon = DurationParser.parseSeconds(pipeline.getPredictionHorizon());
            if (step == 0 || horizon / step < 1) {
                result.addError("prediction_horizon", "must be at least one step ("
                        + pipeline.getStep() + ")");
            }
        }

        checkCron(result, "forecast_schedule", pipeline.getForecastSchedule());
        checkCron(result, "anomaly_schedule", pipeline.getAnomalySchedule());

        validateSeries(pipeline, result);
        validateModel(pipeline.getModel(), result);
        validateAnomaly(pipeline.getAnomaly(), result);

        TrainingConfig training = pipeline.getTraining();
        if (training != null) {
            checkDuration(result, "training.window", training.getWindow());
            checkCron(result, "training.schedule", training.getSchedule());
            if (training.isEventsEnabled() && isBlank(training.getEventTopic())) {
                result.addError("training.event_topic", "is required when events are enabled");
            }
        }

        if (pipeline.getOutput() == null) {
            result.addError("output", "is required");
        }
        return result;
    }

    /**
     * @throws ConfigurationException 携带全部校验错误
     */
    public static void validateOrThrow(Pipeline pipeline) {
        ValidationResult result = validate(pipeline);
        if (!result.isValid()) {
            String name = pipeline != null ? pipeline.getName() : null;
            throw new ConfigurationException("Invalid pipeline '" + name + "': " + result,
                    result.getErrors());
        }
    }

    private static void validateSeries(Pipeline pipeline, ValidationResult result) {
        if (pipeline.getSeriesType() == null) {
            result.addError("series_type", "is required");
            return;
        }
        if (pipeline.getSeriesType() == SeriesType.COVARIATE && pipeline.getCovariates().isEmpty()) {
            result.addError("covariates", "at least one covariate is required for series_type covariate");
        }
        for (int i = 0; i < pipeline.getCovariates().size(); i++) {
            CovariateConfig c = pipeline.getCovariates().get(i);
            if (c == null || isBlank(c.getQuery()) || isBlank(c.getName())) {
                result.addError("covariates[" + i + "]", "query and name are required");
            }
        }
    }

    private static void validateModel(ModelConfig model, ValidationResult result) {
        if (model == null) {
            result.addError("model", "is required");
            return;
        }
        if (model.getType() == ModelType.REMOTE && isBlank(model.getEndpoint())) {
            result.addError("model.endpoint", "is required for remote models");
        }
        if (model.getType() == ModelType.LOCAL && isBlank(model.getId())) {
            result.addWarning("model.id", "not set, the model provider default is used");
        }
        for (Double level : model.getQuantileLevels()) {
            if (level == null || level <= 0.0 || level >= 1.0) {
                result.addError("model.quantile_levels", "level must be in (0,1), got " + level);
            }
        }
    }

    private static void validateAnomaly(AnomalyConfig anomaly, ValidationResult result) {
        if (anomaly == null) {
            result.addError("anomaly", "is required");
            return;
        }
        if (anomaly.getTechnique() == null) {
            result.addError("anomaly.technique", "is required");
        }
        if (anomaly.getConfidenceLevel() <= 0.0 || anomaly.getConfidenceLevel() >= 1.0) {
            result.addError("anomaly.confidence_level", "must be in (0,1), got " + anomaly.getConfidenceLevel());
        }
        if (anomaly.getThreshold() <= 0.0) {
            result.addError("anomaly.threshold", "must be positive, got " + anomaly.getThreshold());
        }
        if (anomaly.getResidualWindow() < 2) {
            result.addError("anomaly.residual_window", "must be at least 2, got " + anomaly.getResidualWindow());
        }
    }

    private static boolean checkDuration(ValidationResult result, String field, String value) {
        if (!DurationParser.isValid(value)) {
            result.addError(field, "invalid duration '" + value + "'");
            return false;
        }
        return true;
    }

    private static void checkCron(ValidationResult result, String field, String value) {
        if (!CronSchedules.isValid(value)) {
            result.addError(field, "invalid cron expression '" + value + "'");
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
