package com.pipeline.anomaly.core.impl;

import com.pipeline.anomaly.core.AnomalyEngine;
import com.pipeline.anomaly.core.AnomalyScorer;
import com.pipeline.anomaly.core.ForecastLoop;
import com.pipeline.anomaly.core.ForecastingModel;
import com.pipeline.anomaly.core.ScorerManager;
import com.pipeline.anomaly.core.ScoringContext;
import com.pipeline.anomaly.core.TimeSeriesStore;
import com.pipeline.anomaly.exception.UnsupportedTechniqueException;
import com.pipeline.anomaly.model.AlignedPoint;
import com.pipeline.anomaly.model.AnomalyConfig;
import com.pipeline.anomaly.model.AnomalyScore;
import com.pipeline.anomaly.model.AnomalyTechnique;
import com.pipeline.anomaly.model.ForecastPoint;
import com.pipeline.anomaly.model.ForecastResult;
import com.pipeline.anomaly.model.Pipeline;
import com.pipeline.anomaly.model.TimeSeriesRow;
import com.pipeline.anomaly.scoring.ConfidenceIntervalScorer;
import com.pipeline.anomaly.util.DurationParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * 异常检测引擎默认实现。
 *
 * 一次周期：
 *   1. 取 [now − 预测时长, now] 的实际值
 *   2. 以 now − 预测时长 为锚点重新生成预测，使预测与实际值在时间上对齐
 *   3. 每个预测点匹配半个步长以内最近的实际值，缺失实际值的点跳过
 *   4. 交给该管道配置的评分器逐点评分，按输出策略写回
 */
public class DefaultAnomalyEngine implements AnomalyEngine {

    private static final Logger log = LoggerFactory.getLogger(DefaultAnomalyEngine.class);

    private final TimeSeriesStore store;
    private final ForecastingModel model;
    private final ForecastLoop forecastLoop;
    private final ScorerManager scorerManager;
    private final PortCallExecutor executor;

    public DefaultAnomalyEngine(TimeSeriesStore store, ForecastingModel model, ForecastLoop forecastLoop,
                                ScorerManager scorerManager, PortCallExecutor executor) {
        this.store = store;
        this.model = model;
        this.forecastLoop = forecastLoop;
        this.scorerManager = scorerManager;
        this.executor = executor;
    }

    @Override
    public List<AnomalyScore> runAnomalyCheck(Pipeline pipeline, Instant now) {
        String name = pipeline.getName();
        AnomalyConfig config = pipeline.getAnomaly();
        AnomalyTechnique technique = config.getTechnique();

        AnomalyScorer scorer = scorerManager.getScorer(technique);
        if (scorer == null) {
            throw new UnsupportedTechniqueException(technique,
                    "Pipeline '" + name + "': no scorer registered for technique '" + technique + "'");
        }
        scorer.checkSupported(name, model);
        long horizonSeconds = DurationParser.parseSeconds(pipeline.getPredictionHorizon());
        long stepSeconds = DurationParser.parseSeconds(pipeline.getStep());
        DefaultForecastLoop.predictionLength(pipeline);

        Instant anchor = now.minusSeconds(horizonSeconds);
        List<TimeSeriesRow> fetched = executor.callStore("queryRange",
                () -> store.queryRange(pipeline.getQuery(), anchor, now, pipeline.getStep()));
        if (fetched == null || fetched.isEmpty()) {
            log.warn("Pipeline '{}': no actuals in [{}, {}], skipping anomaly check.", name, anchor, now);
            return Collections.emptyList();
        }

        ForecastResult forecast = forecastLoop.generateForecast(pipeline, anchor, extraQuantiles(config));
        if (forecast.isEmpty()) {
            log.warn("Pipeline '{}': no forecast anchored at {}, skipping anomaly check.", name, anchor);
            return Collections.emptyList();
        }

        List<TimeSeriesRow> actuals = targetActuals(fetched, forecast.getSeriesId());
        List<AlignedPoint> aligned = align(forecast, actuals, Duration.ofSeconds(stepSeconds).dividedBy(2));
        if (aligned.size() < forecast.size()) {
            log.info("Pipeline '{}': {} of {} forecast points have no matching actual, skipped.",
                    name, forecast.size() - aligned.size(), forecast.size());
        }

        ScoringContext context = new ScoringContext(name, config, aligned, actuals, forecast, model, executor);
        List<AnomalyScore> scores = scorer.score(context);

        long flagged = scores.stream().filter(AnomalyScore::isAnomaly).count();
        log.info("Pipeline '{}': scored {} points with {}, {} anomalous.", name, scores.size(), technique, flagged);

        if (scores.isEmpty()) {
            return scores;
        }
        if (pipeline.getOutput().isWriteAnomalyScore()) {
            writeScores(pipeline, scores);
        } else {
            log.info("Pipeline '{}': anomaly score output disabled, nothing written.", name);
        }
        return scores;
    }

    private void writeScores(Pipeline pipeline, List<AnomalyScore> scores) {
        String scoreId = ResultSeriesNames.anomaly(pipeline, ResultSeriesNames.TYPE_ANOMALY_SCORE);
        String flagId = ResultSeriesNames.anomaly(pipeline, ResultSeriesNames.TYPE_IS_ANOMALY);
        List<TimeSeriesRow> out = new ArrayList<>(scores.size() * 2);
        for (AnomalyScore s : scores) {
            out.add(new TimeSeriesRow(scoreId, s.getTimestamp(), s.getScore()));
            out.add(new TimeSeriesRow(flagId, s.getTimestamp(), s.isAnomaly() ? 1.0 : 0.0));
        }
        executor.runStore("write", () -> store.write(out));
        log.info("Pipeline '{}': wrote {} anomaly rows.", pipeline.getName(), out.size());
    }

    private static Collection<Double> extraQuantiles(AnomalyConfig config) {
        if (config.getTechnique() == AnomalyTechnique.CONFIDENCE_INTERVAL) {
            return ConfidenceIntervalScorer.bandLevelList(config.getConfidenceLevel());
        }
        return Collections.emptyList();
    }

    /**
     * 与预测目标相同的序列；预测未标注序列时取字典序第一条
     */
    private static List<TimeSeriesRow> targetActuals(List<TimeSeriesRow> rows, String seriesId) {
        Map<String, List<TimeSeriesRow>> bySeries = DefaultForecastLoop.groupBySeries(rows);
        if (seriesId != null && bySeries.containsKey(seriesId)) {
            return bySeries.get(seriesId);
        }
        return bySeries.values().iterator().next();
    }

    /**
     * 每个预测点匹配容差内时间最近的实际值
     */
    static List<AlignedPoint> align(ForecastResult forecast, List<TimeSeriesRow> actuals, Duration tolerance) {
        NavigableMap<Instant, Double> byTime = new TreeMap<>();
        for (TimeSeriesRow row : actuals) {
            byTime.put(row.getTimestamp(), row.getValue());
        }

        List<AlignedPoint> aligned = new ArrayList<>();
        for (ForecastPoint point : forecast.getPoints()) {
            Instant ts = point.getTimestamp();
            Map.Entry<Instant, Double> floor = byTime.floorEntry(ts);
            Map.Entry<Instant, Double> ceiling = byTime.ceilingEntry(ts);
            Map.Entry<Instant, Double> nearest = floor;
            if (nearest == null || (ceiling != null
                    && Duration.between(ts, ceiling.getKey()).compareTo(Duration.between(floor.getKey(), ts)) < 0)) {
                nearest = ceiling;
            }
            if (nearest == null) {
                continue;
            }
            Duration gap = Duration.between(nearest.getKey(), ts).abs();
            if (gap.compareTo(tolerance) > 0) {
                log.debug("No actual within {} of forecast point {}", tolerance, ts);
                continue;
            }
            aligned.add(new AlignedPoint(ts, nearest.getValue(), point));
        }
        return aligned;
    }
}
