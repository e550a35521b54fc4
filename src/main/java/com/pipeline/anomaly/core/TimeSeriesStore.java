package com.pipeline.anomaly.core;

import com.pipeline.anomaly.model.TimeSeriesRow;

import java.time.Instant;
import java.util.List;

/**
 * 时序存储端口：引擎读取上下文数据、写回预测与异常结果的唯一通道。
 *
 * 读取和写入的行都以 {@code series_id} 标识所属序列，写入时使用
 * {@link com.pipeline.anomaly.util.MetricIdCodec} 的编码格式。
 * 写入按 (series_id, timestamp) 幂等，重复执行同一周期不会产生重复数据。
 */
public interface TimeSeriesStore {

    /**
     * 区间查询。
     *
     * @param query 存储相关的选择器字符串
     * @param start 起始时间（含）
     * @param end   结束时间（含）
     * @param step  采样间隔，紧凑时长格式
     * @return 按时间排序的行，每行携带解析后的序列标识；无数据返回空列表
     */
    List<TimeSeriesRow> queryRange(String query, Instant start, Instant end, String step);

    /**
     * 批量写入
     */
    void write(List<TimeSeriesRow> rows);
}
