package com.pipeline.anomaly.core;

import com.pipeline.anomaly.model.AnomalyScore;
import com.pipeline.anomaly.model.AnomalyTechnique;

import java.util.List;

/**
 * 异常评分器接口：每种异常检测方法对应一个实现。
 *
 * 实现约定：
 * - 无状态、线程安全，同一实例会被多个管道并发使用
 * - 每个对齐点输出一个评分，score 取值 [0,1]
 * - 不支持的模型组合抛出 UnsupportedTechniqueException，不做降级
 */
public interface AnomalyScorer {

    AnomalyTechnique getTechnique();

    /**
     * 在任何I/O之前检查当前模型能否支持本方法，默认总是支持
     *
     * @throws com.pipeline.anomaly.exception.UnsupportedTechniqueException 模型不支持
     */
    default void checkSupported(String pipelineName, ForecastingModel model) {
    }

    List<AnomalyScore> score(ScoringContext context);
}
