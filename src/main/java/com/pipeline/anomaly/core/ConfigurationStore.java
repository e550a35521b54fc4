package com.pipeline.anomaly.core;

import com.pipeline.anomaly.model.Pipeline;

import java.util.List;

/**
 * 管道配置存储端口。任何后端（关系库、文档库、文件）都可以实现。
 */
public interface ConfigurationStore {

    /**
     * @return 全部管道定义
     */
    List<Pipeline> list();

    /**
     * @param name 管道名
     * @return 管道定义；不存在返回null
     */
    Pipeline get(String name);

    /**
     * 按name新增或覆盖
     */
    void save(Pipeline pipeline);

    /**
     * @return 是否确实删除了一条记录
     */
    boolean delete(String name);
}
