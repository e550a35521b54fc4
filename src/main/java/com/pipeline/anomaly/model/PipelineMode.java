package com.pipeline.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 管道运行模式，决定预测任务与异常检测任务是否产出结果
 */
public enum PipelineMode {
    /** 仅预测 */
    FORECAST_ONLY("forecast_only"),
    /** 仅异常检测 */
    ANOMALY_ONLY("anomaly_only"),
    /** 预测与异常检测 */
    FORECAST_AND_ANOMALY("forecast_and_anomaly");

    private final String value;

    PipelineMode(String value) {
        this.value = value;
    }

    /** 配置与序列化中使用的取值 */
    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static PipelineMode fromValue(String value) {
        for (PipelineMode candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown pipeline mode: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
