package com.pipeline.anomaly.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * 预测请求：预测步数、分位数集合（升序去重）、模型参数
 */
public class ForecastRequest implements Serializable {
    private final int predictionLength;
    private final List<Double> quantileLevels;
    private final Map<String, Object> parameters;

    public ForecastRequest(int predictionLength, Collection<Double> quantileLevels,
                           Map<String, Object> parameters) {
        if (predictionLength <= 0) {
            throw new IllegalArgumentException("Prediction length must be positive, got: " + predictionLength);
        }
        TreeSet<Double> levels = new TreeSet<>();
        if (quantileLevels != null) {
            for (Double level : quantileLevels) {
                if (level == null || level <= 0.0 || level >= 1.0) {
                    throw new IllegalArgumentException("Quantile level must be in (0,1), got: " + level);
                }
                levels.add(level);
            }
        }
        this.predictionLength = predictionLength;
        this.quantileLevels = Collections.unmodifiableList(new ArrayList<>(levels));
        this.parameters = Collections.unmodifiableMap(
                parameters != null ? new LinkedHashMap<>(parameters) : new LinkedHashMap<>());
    }

    public int getPredictionLength() { return predictionLength; }
    public List<Double> getQuantileLevels() { return quantileLevels; }
    public Map<String, Object> getParameters() { return parameters; }

    @Override
    public String toString() {
        return "ForecastRequest{predictionLength=" + predictionLength
                + ", quantiles=" + quantileLevels + ", parameters=" + parameters.keySet() + "}";
    }
}
