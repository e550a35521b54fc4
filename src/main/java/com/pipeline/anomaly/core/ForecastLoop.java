package com.pipeline.anomaly.core;

import com.pipeline.anomaly.model.ForecastResult;
import com.pipeline.anomaly.model.Pipeline;

import java.time.Instant;
import java.util.Collection;

/**
 * 预测循环：拉取上下文窗口 → 构造预测请求 → 调用模型 → 整形输出 → 写回。
 */
public interface ForecastLoop {

    /**
     * 执行一个完整的预测周期。无数据或模型无结果时记录日志后返回。
     */
    void runForecast(Pipeline pipeline, Instant now);

    /**
     * 只做预测不写回。
     *
     * @return 目标序列的预测结果，seriesId为目标序列标识；无数据返回空结果
     * @throws com.pipeline.anomaly.exception.DataInsufficiencyException 上下文不足两行
     */
    ForecastResult generateForecast(Pipeline pipeline, Instant now);

    /**
     * 同上，额外请求指定的分位数
     */
    ForecastResult generateForecast(Pipeline pipeline, Instant now, Collection<Double> extraQuantiles);

    /**
     * 将预测结果按均值和各分位数展开成输出序列，单次批量写入
     */
    void writeForecastResults(Pipeline pipeline, ForecastResult result);
}
