package com.pipeline.anomaly.core;

import com.pipeline.anomaly.model.Pipeline;

/**
 * 根据管道的模型配置获取模型句柄
 */
public interface ModelProvider {

    ForecastingModel forPipeline(Pipeline pipeline);
}
