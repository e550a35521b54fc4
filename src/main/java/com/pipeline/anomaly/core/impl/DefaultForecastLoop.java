package com.pipeline.anomaly.core.impl;

import com.pipeline.anomaly.core.ForecastLoop;
import com.pipeline.anomaly.core.ForecastingModel;
import com.pipeline.anomaly.core.TimeSeriesStore;
import com.pipeline.anomaly.exception.ConfigurationException;
import com.pipeline.anomaly.exception.DataInsufficiencyException;
import com.pipeline.anomaly.exception.InvalidForecastException;
import com.pipeline.anomaly.model.CovariateConfig;
import com.pipeline.anomaly.model.ForecastPoint;
import com.pipeline.anomaly.model.ForecastRequest;
import com.pipeline.anomaly.model.ForecastResult;
import com.pipeline.anomaly.model.Pipeline;
import com.pipeline.anomaly.model.SeriesType;
import com.pipeline.anomaly.model.TimeSeriesRow;
import com.pipeline.anomaly.util.DurationParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 预测循环默认实现。
 *
 * 一次周期：
 *   1. 由上下文窗口计算起点，拉取 [start, now] 的数据
 *   2. prediction_length = 预测时长 / 步长（取整，至少为1）
 *   3. 构造预测请求并调用模型
 *   4. 每个未来时间点输出一行均值和每个分位数各一行，单次批量写入
 *
 * 时长配置在任何I/O之前校验；上下文少于两行时无法推断采样频率，直接失败。
 * 模型结果多于预测长度时截断，少于预测长度或间隔不等于步长时失败。
 */
public class DefaultForecastLoop implements ForecastLoop {

    private static final Logger log = LoggerFactory.getLogger(DefaultForecastLoop.class);

    /** 管道未配置分位数时使用的默认集合 */
    public static final List<Double> DEFAULT_QUANTILES =
            Collections.unmodifiableList(Arrays.asList(0.1, 0.5, 0.9, 0.95, 0.99));

    private final TimeSeriesStore store;
    private final ForecastingModel model;
    private final PortCallExecutor executor;

    public DefaultForecastLoop(TimeSeriesStore store, ForecastingModel model, PortCallExecutor executor) {
        this.store = store;
        this.model = model;
        this.executor = executor;
    }

    @Override
    public void runForecast(Pipeline pipeline, Instant now) {
        ForecastResult result = generateForecast(pipeline, now);
        if (result.isEmpty()) {
            return;
        }
        if (!pipeline.getOutput().isWriteForecast()) {
            log.info("Pipeline '{}': forecast output disabled, {} points not written.",
                    pipeline.getName(), result.size());
            return;
        }
        writeForecastResults(pipeline, result);
    }

    @Override
    public ForecastResult generateForecast(Pipeline pipeline, Instant now) {
        return generateForecast(pipeline, now, Collections.emptyList());
    }

    @Override
    public ForecastResult generateForecast(Pipeline pipeline, Instant now, Collection<Double> extraQuantiles) {
        String name = pipeline.getName();
        long contextSeconds = DurationParser.parseSeconds(pipeline.getContextWindow());
        int predictionLength = predictionLength(pipeline);
        Instant start = now.minusSeconds(contextSeconds);

        List<TimeSeriesRow> rows = fetch(pipeline.getQuery(), start, now, pipeline.getStep());
        if (rows.isEmpty()) {
            log.warn("Pipeline '{}': no data for query '{}' in [{}, {}], skipping forecast.",
                    name, pipeline.getQuery(), start, now);
            return ForecastResult.empty();
        }

        Map<String, List<TimeSeriesRow>> bySeries = groupBySeries(rows);
        String targetSeries = bySeries.keySet().iterator().next();
        List<TimeSeriesRow> target = bySeries.get(targetSeries);
        if (bySeries.size() > 1 && pipeline.getSeriesType() != SeriesType.MULTIVARIATE) {
            log.warn("Pipeline '{}': query returned {} series, forecasting target '{}' only.",
                    name, bySeries.size(), targetSeries);
        }
        if (target.size() < 2) {
            throw new DataInsufficiencyException("Pipeline '" + name + "': need at least 2 context rows for series '"
                    + targetSeries + "' to infer sampling frequency, got " + target.size());
        }

        List<TimeSeriesRow> input = buildModelInput(pipeline, bySeries, target, start, now);

        TreeSet<Double> quantiles = new TreeSet<>(quantileLevels(pipeline));
        if (extraQuantiles != null) {
            quantiles.addAll(extraQuantiles);
        }
        ForecastRequest request = new ForecastRequest(predictionLength, quantiles,
                pipeline.getModel().getParameters());

        log.debug("Pipeline '{}': invoking model with {} rows, {}", name, input.size(), request);
        ForecastResult result = executor.callModel("predict", () -> model.predict(input, request));
        if (result == null || result.isEmpty()) {
            log.warn("Pipeline '{}': model returned no forecast.", name);
            return ForecastResult.empty();
        }

        if (result.size() > predictionLength) {
            log.warn("Pipeline '{}': model returned {} points, truncating to {}.",
                    name, result.size(), predictionLength);
            result = result.truncate(predictionLength);
        }
        checkShape(name, result, predictionLength, DurationParser.parseSeconds(pipeline.getStep()));

        log.info("Pipeline '{}': generated {} forecast points for '{}'.", name, result.size(), targetSeries);
        return result.withSeriesId(targetSeries);
    }

    @Override
    public void writeForecastResults(Pipeline pipeline, ForecastResult result) {
        if (result == null || result.isEmpty()) {
            return;
        }
        String meanId = ResultSeriesNames.forecastMean(pipeline);
        Map<Double, String> quantileIds = new TreeMap<>();

        List<TimeSeriesRow> out = new ArrayList<>();
        for (ForecastPoint point : result.getPoints()) {
            out.add(new TimeSeriesRow(meanId, point.getTimestamp(), point.getMean()));
            for (Map.Entry<Double, Double> q : point.getQuantiles().entrySet()) {
                String id = quantileIds.computeIfAbsent(q.getKey(),
                        level -> ResultSeriesNames.forecastQuantile(pipeline, level));
                out.add(new TimeSeriesRow(id, point.getTimestamp(), q.getValue()));
            }
        }

        executor.runStore("write", () -> store.write(out));
        log.info("Pipeline '{}': wrote {} forecast rows.", pipeline.getName(), out.size());
    }

    /**
     * 预测时长除以步长，向下取整
     *
     * @throws ConfigurationException 结果小于1
     */
    public static int predictionLength(Pipeline pipeline) {
        long horizon = DurationParser.parseSeconds(pipeline.getPredictionHorizon());
        long step = DurationParser.parseSeconds(pipeline.getStep());
        long length = (step > 0) ? horizon / step : 0;
        if (length < 1) {
            throw new ConfigurationException("Pipeline '" + pipeline.getName()
                    + "': prediction_horizon " + pipeline.getPredictionHorizon()
                    + " is shorter than step " + pipeline.getStep());
        }
        if (length > Integer.MAX_VALUE) {
            throw new ConfigurationException("Pipeline '" + pipeline.getName()
                    + "': prediction length " + length + " is too large");
        }
        return (int) length;
    }

    /**
     * 结果必须恰好覆盖 predictionLength 个时间点，且相邻时间戳间隔等于步长
     *
     * @throws InvalidForecastException 点数不足或间隔不符
     */
    static void checkShape(String name, ForecastResult result, int predictionLength, long stepSeconds) {
        if (result.size() < predictionLength) {
            throw new InvalidForecastException("Pipeline '" + name + "': model returned " + result.size()
                    + " forecast points, expected " + predictionLength);
        }
        List<ForecastPoint> points = result.getPoints();
        for (int i = 1; i < points.size(); i++) {
            Instant prev = points.get(i - 1).getTimestamp();
            Instant curr = points.get(i).getTimestamp();
            long gap = curr.getEpochSecond() - prev.getEpochSecond();
            if (gap != stepSeconds || curr.getNano() != prev.getNano()) {
                throw new InvalidForecastException("Pipeline '" + name + "': forecast points " + prev + " and "
                        + curr + " are not spaced at step of " + stepSeconds + "s");
            }
        }
    }

    static List<Double> quantileLevels(Pipeline pipeline) {
        List<Double> configured = pipeline.getModel().getQuantileLevels();
        return (configured == null || configured.isEmpty()) ? DEFAULT_QUANTILES : configured;
    }

    private List<TimeSeriesRow> buildModelInput(Pipeline pipeline, Map<String, List<TimeSeriesRow>> bySeries,
                                                List<TimeSeriesRow> target, Instant start, Instant now) {
        switch (pipeline.getSeriesType()) {
            case MULTIVARIATE: {
                List<TimeSeriesRow> all = new ArrayList<>();
                bySeries.values().forEach(all::addAll);
                return all;
            }
            case COVARIATE: {
                List<TimeSeriesRow> input = new ArrayList<>(target);
                for (CovariateConfig covariate : pipeline.getCovariates()) {
                    List<TimeSeriesRow> rows = fetch(covariate.getQuery(), start, now, pipeline.getStep());
                    if (rows.isEmpty()) {
                        log.warn("Pipeline '{}': covariate '{}' returned no data.",
                                pipeline.getName(), covariate.getName());
                    }
                    for (TimeSeriesRow row : rows) {
                        input.add(row.withSeriesId(covariate.getName()));
                    }
                }
                return input;
            }
            case UNIVARIATE:
            default:
                return target;
        }
    }

    private List<TimeSeriesRow> fetch(String query, Instant start, Instant end, String step) {
        List<TimeSeriesRow> rows = executor.callStore("queryRange",
                () -> store.queryRange(query, start, end, step));
        return rows != null ? rows : Collections.emptyList();
    }

    /**
     * 按序列标识分组（字典序），组内按时间排序
     */
    static Map<String, List<TimeSeriesRow>> groupBySeries(List<TimeSeriesRow> rows) {
        Map<String, List<TimeSeriesRow>> bySeries = new TreeMap<>();
        for (TimeSeriesRow row : rows) {
            String id = row.getSeriesId() != null ? row.getSeriesId() : "";
            bySeries.computeIfAbsent(id, k -> new ArrayList<>()).add(row);
        }
        for (List<TimeSeriesRow> series : bySeries.values()) {
            series.sort((a, b) -> a.getTimestamp().compareTo(b.getTimestamp()));
        }
        return bySeries;
    }
}
