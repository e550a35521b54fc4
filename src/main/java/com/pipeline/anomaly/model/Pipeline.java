package com.pipeline.anomaly.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * 管道实体：一条被监控的查询及其预测、异常检测、训练任务的完整定义。
 *
 * name 是唯一标识，创建后不可变更；其余字段均可更新。
 * 时长字段使用紧凑格式（如 "1m"、"1h"），调度字段使用5段cron表达式，
 * 两者都必须在创建时通过校验，否则管道无效。
 */
public class Pipeline implements Serializable {

    // ---- 标识 ----
    private String name;
    private String description = "";
    /** 总开关，关闭后所有任务的调度条目都会被移除 */
    private boolean enabled = true;

    // ---- 数据源 ----
    private String query;
    private String step = "1m";

    // ---- 时间窗口 ----
    private String contextWindow = "1h";
    private String predictionHorizon = "15m";

    private PipelineMode mode = PipelineMode.FORECAST_AND_ANOMALY;

    // ---- 调度 ----
    private boolean forecastEnabled = true;
    private String forecastSchedule = "*/5 * * * *";
    private boolean anomalyEnabled = true;
    private String anomalySchedule = "*/1 * * * *";

    // ---- 序列类型 ----
    private SeriesType seriesType = SeriesType.UNIVARIATE;
    private List<CovariateConfig> covariates = new ArrayList<>();

    private ModelConfig model = new ModelConfig();
    /** 为空表示不训练 */
    private TrainingConfig training;
    private AnomalyConfig anomaly = new AnomalyConfig();
    private OutputConfig output = new OutputConfig();

    // ---- 基础设施覆盖项，为空时使用全局配置 ----
    private String storeReadUrl;
    private String storeWriteUrl;

    public Pipeline() {}

    public Pipeline(String name, String query) {
        this.name = name;
        this.query = query;
    }

    /**
     * 指定类型任务的开关。训练任务取决于训练配置是否存在且启用。
     */
    public boolean isTaskEnabled(TaskKind kind) {
        switch (kind) {
            case FORECAST:
                return forecastEnabled;
            case ANOMALY:
                return anomalyEnabled;
            case TRAINING:
                return training != null && training.isEnabled();
            default:
                return false;
        }
    }

    /**
     * 指定类型任务的cron表达式；未配置训练时训练任务返回null。
     */
    public String getSchedule(TaskKind kind) {
        switch (kind) {
            case FORECAST:
                return forecastSchedule;
            case ANOMALY:
                return anomalySchedule;
            case TRAINING:
                return (training != null) ? training.getSchedule() : null;
            default:
                return null;
        }
    }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public String getQuery() { return query; }
    public void setQuery(String query) { this.query = query; }
    public String getStep() { return step; }
    public void setStep(String step) { this.step = step; }
    public String getContextWindow() { return contextWindow; }
    public void setContextWindow(String contextWindow) { this.contextWindow = contextWindow; }
    public String getPredictionHorizon() { return predictionHorizon; }
    public void setPredictionHorizon(String predictionHorizon) { this.predictionHorizon = predictionHorizon; }
    public PipelineMode getMode() { return mode; }
    public void setMode(PipelineMode mode) { this.mode = mode; }
    public boolean isForecastEnabled() { return forecastEnabled; }
    public void setForecastEnabled(boolean forecastEnabled) { this.forecastEnabled = forecastEnabled; }
    public String getForecastSchedule() { return forecastSchedule; }
    public void setForecastSchedule(String forecastSchedule) { this.forecastSchedule = forecastSchedule; }
    public boolean isAnomalyEnabled() { return anomalyEnabled; }
    public void setAnomalyEnabled(boolean anomalyEnabled) { this.anomalyEnabled = anomalyEnabled; }
    public String getAnomalySchedule() { return anomalySchedule; }
    public void setAnomalySchedule(String anomalySchedule) { this.anomalySchedule = anomalySchedule; }
    public SeriesType getSeriesType() { return seriesType; }
    public void setSeriesType(SeriesType seriesType) { this.seriesType = seriesType; }
    public List<CovariateConfig> getCovariates() { return covariates; }
    public void setCovariates(List<CovariateConfig> covariates) {
        this.covariates = (covariates != null) ? covariates : new ArrayList<>();
    }
    public ModelConfig getModel() { return model; }
    public void setModel(ModelConfig model) { this.model = model; }
    public TrainingConfig getTraining() { return training; }
    public void setTraining(TrainingConfig training) { this.training = training; }
    public AnomalyConfig getAnomaly() { return anomaly; }
    public void setAnomaly(AnomalyConfig anomaly) { this.anomaly = anomaly; }
    public OutputConfig getOutput() { return output; }
    public void setOutput(OutputConfig output) { this.output = output; }
    public String getStoreReadUrl() { return storeReadUrl; }
    public void setStoreReadUrl(String storeReadUrl) { this.storeReadUrl = storeReadUrl; }
    public String getStoreWriteUrl() { return storeWriteUrl; }
    public void setStoreWriteUrl(String storeWriteUrl) { this.storeWriteUrl = storeWriteUrl; }

    @Override
    public String toString() {
        return "Pipeline{name='" + name + "', query='" + query + "', step=" + step
                + ", mode=" + mode + ", enabled=" + enabled + "}";
    }
}
