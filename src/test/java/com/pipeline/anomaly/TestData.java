package com.pipeline.anomaly;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.IntToDoubleFunction;

import com.pipeline.anomaly.model.ForecastPoint;
import com.pipeline.anomaly.model.ForecastResult;
import com.pipeline.anomaly.model.Pipeline;
import com.pipeline.anomaly.model.TimeSeriesRow;

/**
 * Fixtures shared by the engine tests.
 */
public final class TestData {

    public static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");
    public static final Duration MINUTE = Duration.ofMinutes(1);

    private TestData() {}

    /** pipeline "cpu" over query "up" with step 1m, context 1h, horizon 15m */
    public static Pipeline pipeline() {
        Pipeline p = new Pipeline("cpu", "up");
        p.getModel().setId("chronos-small");
        return p;
    }

    public static List<TimeSeriesRow> series(String seriesId, Instant start, int count, IntToDoubleFunction value) {
        List<TimeSeriesRow> rows = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            rows.add(new TimeSeriesRow(seriesId, start.plus(MINUTE.multipliedBy(i)), value.applyAsDouble(i)));
        }
        return rows;
    }

    /**
     * Forecast with one point per minute after {@code start}, mean given by {@code mean}
     * and quantile bands at mean -/+ {@code halfWidth} for levels 0.025/0.975 and 0.1/0.9.
     */
    public static ForecastResult forecast(Instant start, int count, IntToDoubleFunction mean, double halfWidth) {
        List<ForecastPoint> points = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            double m = mean.applyAsDouble(i);
            Map<Double, Double> q = new TreeMap<>();
            q.put(0.025, m - halfWidth);
            q.put(0.1, m - halfWidth / 2);
            q.put(0.9, m + halfWidth / 2);
            q.put(0.975, m + halfWidth);
            points.add(new ForecastPoint(start.plus(MINUTE.multipliedBy(i + 1)), m, q));
        }
        return new ForecastResult(null, points);
    }
}
