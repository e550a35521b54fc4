package com.pipeline.anomaly.core;

import com.pipeline.anomaly.model.Pipeline;
import com.pipeline.anomaly.model.ScheduleEntry;

import java.util.Set;

/**
 * 调度同步器：使外部调度器中的条目与管道配置保持一致。
 *
 * 同步点是调度后端按条目名的upsert/delete，不使用进程内锁；
 * 对同一管道并发或重复调用最终状态相同。
 */
public interface ScheduleSynchronizer {

    /**
     * @return 本次同步后应存在的条目
     */
    Set<ScheduleEntry> reconcile(Pipeline pipeline);

    /**
     * 无条件删除该管道的全部三个条目
     */
    void remove(String pipelineName);
}
