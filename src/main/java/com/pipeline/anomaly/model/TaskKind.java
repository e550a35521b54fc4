package com.pipeline.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 管道的三类定时任务。
 * 每类任务对应外部调度器中的一个任务标识，调度条目以 pipeline_&lt;name&gt;_&lt;kind&gt; 为键。
 */
public enum TaskKind {
    FORECAST("forecast", "openanomaly.tasks.run_forecast"),
    ANOMALY("anomaly", "openanomaly.tasks.run_anomaly_check"),
    TRAINING("training", "openanomaly.tasks.train_model");

    private final String value;
    private final String taskName;

    TaskKind(String value, String taskName) {
        this.value = value;
        this.taskName = taskName;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** 外部调度器中注册的任务标识 */
    public String getTaskName() {
        return taskName;
    }

    @JsonCreator
    public static TaskKind fromValue(String value) {
        for (TaskKind candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown task kind: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
