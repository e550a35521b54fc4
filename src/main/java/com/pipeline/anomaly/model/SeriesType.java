package com.pipeline.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 输入序列类型
 */
public enum SeriesType {
    /** 单变量：仅目标序列 */
    UNIVARIATE("univariate"),
    /** 多变量：查询返回的全部序列 */
    MULTIVARIATE("multivariate"),
    /** 目标序列 + 协变量序列 */
    COVARIATE("covariate");

    private final String value;

    SeriesType(String value) {
        this.value = value;
    }

    /** 配置与序列化中使用的取值 */
    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static SeriesType fromValue(String value) {
        for (SeriesType candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown series type: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
