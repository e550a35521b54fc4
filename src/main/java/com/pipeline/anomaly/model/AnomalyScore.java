package com.pipeline.anomaly.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * 单点异常评分。score 取值 [0,1]，0 表示正常，1 表示高度异常。
 * 每个检测周期重新计算，仅通过时序存储端口写出。
 */
public class AnomalyScore implements Serializable {
    private final Instant timestamp;
    private final double actualValue;
    private final double predictedValue;
    private final double score;
    private final boolean anomaly;

    public AnomalyScore(Instant timestamp, double actualValue, double predictedValue,
                        double score, boolean anomaly) {
        this.timestamp = timestamp;
        this.actualValue = actualValue;
        this.predictedValue = predictedValue;
        this.score = score;
        this.anomaly = anomaly;
    }

    public Instant getTimestamp() { return timestamp; }
    public double getActualValue() { return actualValue; }
    public double getPredictedValue() { return predictedValue; }
    public double getScore() { return score; }
    public boolean isAnomaly() { return anomaly; }

    @Override
    public String toString() {
        return "AnomalyScore{" + timestamp + ", actual=" + actualValue + ", predicted=" + predictedValue
                + ", score=" + score + ", anomaly=" + anomaly + "}";
    }
}
