package com.pipeline.anomaly.core;

import com.pipeline.anomaly.model.ScheduleEntry;

import java.util.List;

/**
 * 外部定时调度端口。
 *
 * 按条目名做幂等的upsert/delete。集群范围内同一条目每个触发点最多执行一次，
 * 由调度后端自身的锁机制保证，引擎不实现选主。
 */
public interface SchedulerBackend {

    void upsert(ScheduleEntry entry);

    /**
     * 删除不存在的条目不视为错误
     */
    void delete(String key);

    List<ScheduleEntry> list();
}
