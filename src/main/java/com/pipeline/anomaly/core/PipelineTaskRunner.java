package com.pipeline.anomaly.core;

import com.pipeline.anomaly.model.TaskKind;

/**
 * 外部调度器触发任务的统一入口。
 *
 * 按名称解析当前管道配置后分派到预测、异常检测或训练循环。
 * 管道不存在时只记录日志；其余错误原样抛给调度层，由调度层决定重试。
 */
public interface PipelineTaskRunner {

    void runTask(TaskKind kind, String pipelineName);

    /**
     * @return 模型健康检查结果；管道不存在或检查失败返回false
     */
    boolean checkModelHealth(String pipelineName);
}
