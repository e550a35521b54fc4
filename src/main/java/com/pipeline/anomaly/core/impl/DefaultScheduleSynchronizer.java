package com.pipeline.anomaly.core.impl;

import com.pipeline.anomaly.core.ScheduleSynchronizer;
import com.pipeline.anomaly.core.SchedulerBackend;
import com.pipeline.anomaly.model.Pipeline;
import com.pipeline.anomaly.model.ScheduleEntry;
import com.pipeline.anomaly.model.TaskKind;
import com.pipeline.anomaly.util.CronSchedules;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 调度同步器默认实现。
 *
 * 对 forecast / anomaly / training 三类任务分别判断：
 * 管道总开关和任务开关都打开且cron可解析时upsert条目，否则删除该条目。
 * 条目与调度后端中已有的一致时跳过upsert，重复调用不产生多余写入。
 * 调度后端的错误原样抛出。
 */
public class DefaultScheduleSynchronizer implements ScheduleSynchronizer {

    private static final Logger log = LoggerFactory.getLogger(DefaultScheduleSynchronizer.class);

    private final SchedulerBackend backend;

    public DefaultScheduleSynchronizer(SchedulerBackend backend) {
        this.backend = backend;
    }

    @Override
    public Set<ScheduleEntry> reconcile(Pipeline pipeline) {
        String name = pipeline.getName();
        Map<String, ScheduleEntry> existing = indexByName(backend.list());
        Set<ScheduleEntry> desired = new LinkedHashSet<>();

        for (TaskKind kind : TaskKind.values()) {
            String key = ScheduleEntry.keyFor(name, kind);
            String cron = pipeline.getSchedule(kind);
            boolean wanted = pipeline.isEnabled() && pipeline.isTaskEnabled(kind);

            if (wanted && !CronSchedules.isValid(cron)) {
                log.warn("Pipeline '{}': {} schedule '{}' is not a valid cron expression, removing entry.",
                        name, kind, cron);
                wanted = false;
            }

            if (!wanted) {
                backend.delete(key);
                log.debug("Pipeline '{}': {} schedule removed.", name, kind);
                continue;
            }

            ScheduleEntry entry = ScheduleEntry.forTask(name, kind, cron);
            desired.add(entry);
            if (entry.equals(existing.get(key))) {
                log.debug("Pipeline '{}': {} schedule unchanged.", name, kind);
                continue;
            }
            backend.upsert(entry);
            log.info("Pipeline '{}': {} scheduled with '{}'.", name, kind, cron);
        }
        return desired;
    }

    @Override
    public void remove(String pipelineName) {
        for (TaskKind kind : TaskKind.values()) {
            backend.delete(ScheduleEntry.keyFor(pipelineName, kind));
        }
        log.info("Pipeline '{}': all schedules removed.", pipelineName);
    }

    private static Map<String, ScheduleEntry> indexByName(List<ScheduleEntry> entries) {
        Map<String, ScheduleEntry> byName = new HashMap<>();
        if (entries != null) {
            for (ScheduleEntry e : entries) {
                byName.put(e.getName(), e);
            }
        }
        return byName;
    }
}
