package com.pipeline.anomaly.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 单个未来时间点的预测值：均值 + 各分位数取值
 */
public class ForecastPoint implements Serializable {
    private final Instant timestamp;
    private final double mean;
    /** 分位数水平 -> 预测值 */
    private final SortedMap<Double, Double> quantiles;

    public ForecastPoint(Instant timestamp, double mean, Map<Double, Double> quantiles) {
        this.timestamp = timestamp;
        this.mean = mean;
        this.quantiles = Collections.unmodifiableSortedMap(
                quantiles != null ? new TreeMap<>(quantiles) : new TreeMap<>());
    }

    public Instant getTimestamp() { return timestamp; }
    public double getMean() { return mean; }
    public SortedMap<Double, Double> getQuantiles() { return quantiles; }

    public Double getQuantile(double level) {
        return quantiles.get(level);
    }

    /**
     * 返回与目标水平最接近的已有分位数水平；没有任何分位数时返回null。
     */
    public Double nearestQuantileLevel(double level) {
        Double nearest = null;
        for (Double candidate : quantiles.keySet()) {
            if (nearest == null || Math.abs(candidate - level) < Math.abs(nearest - level)) {
                nearest = candidate;
            }
        }
        return nearest;
    }
}
