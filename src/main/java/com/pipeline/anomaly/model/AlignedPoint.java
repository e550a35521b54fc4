package com.pipeline.anomaly.model;

import java.time.Instant;

/**
 * 时间对齐后的实际值与预测值
 */
public class AlignedPoint {
    private final Instant timestamp;
    private final double actual;
    private final ForecastPoint predicted;

    public AlignedPoint(Instant timestamp, double actual, ForecastPoint predicted) {
        this.timestamp = timestamp;
        this.actual = actual;
        this.predicted = predicted;
    }

    public Instant getTimestamp() { return timestamp; }
    public double getActual() { return actual; }
    public ForecastPoint getPredicted() { return predicted; }

    /** 残差 = 实际值 - 预测均值 */
    public double getResidual() {
        return actual - predicted.getMean();
    }
}
