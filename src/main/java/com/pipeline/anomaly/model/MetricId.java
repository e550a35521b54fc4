package com.pipeline.anomaly.model;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 解码后的序列标识：指标名 + 按键排序的标签集合
 */
public class MetricId {
    private final String name;
    private final SortedMap<String, String> labels;

    public MetricId(String name, Map<String, String> labels) {
        this.name = name;
        this.labels = Collections.unmodifiableSortedMap(
                labels != null ? new TreeMap<>(labels) : new TreeMap<>());
    }

    public String getName() { return name; }
    public SortedMap<String, String> getLabels() { return labels; }

    public String getLabel(String key) {
        return labels.get(key);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MetricId)) return false;
        MetricId that = (MetricId) o;
        return Objects.equals(name, that.name) && labels.equals(that.labels);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, labels);
    }

    @Override
    public String toString() {
        return "MetricId{name='" + name + "', labels=" + labels + "}";
    }
}
