package com.pipeline.anomaly.exception;

import com.pipeline.anomaly.model.AnomalyTechnique;

/**
 * 当前模型与引擎组合不支持所配置的异常评分方法。不做降级，直接报告给运维。
 */
public class UnsupportedTechniqueException extends PipelineException {

    private final AnomalyTechnique technique;

    public UnsupportedTechniqueException(AnomalyTechnique technique, String message) {
        super(message);
        this.technique = technique;
    }

    public AnomalyTechnique getTechnique() {
        return technique;
    }
}
