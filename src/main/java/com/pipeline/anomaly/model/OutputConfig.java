package com.pipeline.anomaly.model;

import java.io.Serializable;

/**
 * 结果输出配置：写回哪些结果、结果指标名前缀
 */
public class OutputConfig implements Serializable {
    private boolean writeForecast = true;
    private boolean writeAnomalyScore = true;
    private String metricPrefix = "openanomaly_";

    public OutputConfig() {}

    public boolean isWriteForecast() { return writeForecast; }
    public void setWriteForecast(boolean writeForecast) { this.writeForecast = writeForecast; }
    public boolean isWriteAnomalyScore() { return writeAnomalyScore; }
    public void setWriteAnomalyScore(boolean writeAnomalyScore) { this.writeAnomalyScore = writeAnomalyScore; }
    public String getMetricPrefix() { return metricPrefix; }
    public void setMetricPrefix(String metricPrefix) { this.metricPrefix = metricPrefix; }
}
