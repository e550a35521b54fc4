package com.pipeline.anomaly.core;

import com.pipeline.anomaly.core.impl.PortCallExecutor;
import com.pipeline.anomaly.model.AlignedPoint;
import com.pipeline.anomaly.model.AnomalyConfig;
import com.pipeline.anomaly.model.ForecastResult;
import com.pipeline.anomaly.model.TimeSeriesRow;

import java.util.Collections;
import java.util.List;

/**
 * 一次异常检测周期中评分器可见的全部数据
 */
public class ScoringContext {

    private final String pipelineName;
    private final AnomalyConfig config;
    /** 按时间排序，预测点与实际值已对齐 */
    private final List<AlignedPoint> points;
    private final List<TimeSeriesRow> actuals;
    private final ForecastResult forecast;
    private final ForecastingModel model;
    private final PortCallExecutor executor;

    public ScoringContext(String pipelineName, AnomalyConfig config, List<AlignedPoint> points,
                          List<TimeSeriesRow> actuals, ForecastResult forecast,
                          ForecastingModel model, PortCallExecutor executor) {
        this.pipelineName = pipelineName;
        this.config = config;
        this.points = Collections.unmodifiableList(points);
        this.actuals = Collections.unmodifiableList(actuals);
        this.forecast = forecast;
        this.model = model;
        this.executor = executor;
    }

    public String getPipelineName() { return pipelineName; }
    public AnomalyConfig getConfig() { return config; }
    public List<AlignedPoint> getPoints() { return points; }
    public List<TimeSeriesRow> getActuals() { return actuals; }
    public ForecastResult getForecast() { return forecast; }
    public ForecastingModel getModel() { return model; }
    public PortCallExecutor getExecutor() { return executor; }
}
