package com.pipeline.anomaly.core;

import com.pipeline.anomaly.model.AnomalyScore;
import com.pipeline.anomaly.model.Pipeline;

import java.time.Instant;
import java.util.List;

/**
 * 异常检测引擎。将最近一个预测时长窗口内的实际值与锚定在窗口起点的预测对齐，
 * 按管道配置的方法逐点评分。
 */
public interface AnomalyEngine {

    /**
     * @return 本周期的评分（按时间排序）；无实际数据时返回空列表
     */
    List<AnomalyScore> runAnomalyCheck(Pipeline pipeline, Instant now);
}
