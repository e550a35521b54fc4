package com.pipeline.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 异常评分方法
 */
public enum AnomalyTechnique {
    CONFIDENCE_INTERVAL("confidence_interval"),
    Z_SCORE("z_score"),
    IQR("iqr"),
    /** 由模型端口执行，引擎本身不实现 */
    ISOLATION_FOREST("isolation_forest");

    private final String value;

    AnomalyTechnique(String value) {
        this.value = value;
    }

    /** 配置与序列化中使用的取值 */
    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static AnomalyTechnique fromValue(String value) {
        for (AnomalyTechnique candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown anomaly technique: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
