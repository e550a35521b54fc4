package com.pipeline.anomaly.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一次预测的结果，按时间升序覆盖 predictionLength 个未来时间点。
 * seriesId 为被预测的目标序列标识，由引擎在模型返回后补充。
 */
public class ForecastResult implements Serializable {
    private final String seriesId;
    private final List<ForecastPoint> points;

    public ForecastResult(String seriesId, List<ForecastPoint> points) {
        this.seriesId = seriesId;
        this.points = Collections.unmodifiableList(
                points != null ? new ArrayList<>(points) : new ArrayList<>());
    }

    public static ForecastResult empty() {
        return new ForecastResult(null, Collections.emptyList());
    }

    public String getSeriesId() { return seriesId; }
    public List<ForecastPoint> getPoints() { return points; }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public ForecastResult withSeriesId(String newSeriesId) {
        return new ForecastResult(newSeriesId, points);
    }

    /** 截取前 length 个预测点 */
    public ForecastResult truncate(int length) {
        if (length >= points.size()) {
            return this;
        }
        return new ForecastResult(seriesId, points.subList(0, length));
    }
}
