package com.pipeline.anomaly.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * 时序数据行：(序列标识, 时间戳, 值)。
 * 所有端口之间传递的数据均为该结构的有序列表，seriesId 采用指标标识编码格式。
 */
public class TimeSeriesRow implements Serializable {
    private final String seriesId;
    private final Instant timestamp;
    private final double value;

    public TimeSeriesRow(String seriesId, Instant timestamp, double value) {
        this.seriesId = seriesId;
        this.timestamp = timestamp;
        this.value = value;
    }

    public String getSeriesId() { return seriesId; }
    public Instant getTimestamp() { return timestamp; }
    public double getValue() { return value; }

    /** 复制当前行并替换序列标识 */
    public TimeSeriesRow withSeriesId(String newSeriesId) {
        return new TimeSeriesRow(newSeriesId, timestamp, value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimeSeriesRow)) return false;
        TimeSeriesRow that = (TimeSeriesRow) o;
        return Double.compare(that.value, value) == 0
                && Objects.equals(seriesId, that.seriesId)
                && Objects.equals(timestamp, that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(seriesId, timestamp, value);
    }

    @Override
    public String toString() {
        return seriesId + "@" + timestamp + "=" + value;
    }
}
