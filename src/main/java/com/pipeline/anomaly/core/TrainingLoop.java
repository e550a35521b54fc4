package com.pipeline.anomaly.core;

import com.pipeline.anomaly.model.Pipeline;

import java.time.Instant;

/**
 * 训练循环。返回的新模型标识不在此处持久化，由调用方通过配置存储更新。
 */
public interface TrainingLoop {

    /**
     * @return 新模型标识；未配置训练、训练关闭或无数据时返回null
     */
    String runTraining(Pipeline pipeline);

    String runTraining(Pipeline pipeline, Instant now);
}
