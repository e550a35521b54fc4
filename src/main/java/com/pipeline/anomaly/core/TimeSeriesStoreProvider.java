package com.pipeline.anomaly.core;

import com.pipeline.anomaly.model.Pipeline;

/**
 * 根据管道获取时序存储句柄
 */
public interface TimeSeriesStoreProvider {

    /**
     * @param readUrl  查询地址，管道的 store_read_url 优先，否则为全局配置
     * @param writeUrl 写入地址，管道的 store_write_url 优先，否则为全局配置
     */
    TimeSeriesStore forPipeline(Pipeline pipeline, String readUrl, String writeUrl);
}
