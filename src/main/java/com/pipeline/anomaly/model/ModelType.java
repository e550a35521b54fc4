package com.pipeline.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 预测模型部署方式
 */
public enum ModelType {
    /** 本地基础模型 */
    LOCAL("local"),
    /** 远程HTTP模型服务 */
    REMOTE("remote");

    private final String value;

    ModelType(String value) {
        this.value = value;
    }

    /** 配置与序列化中使用的取值 */
    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ModelType fromValue(String value) {
        for (ModelType candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown model type: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
