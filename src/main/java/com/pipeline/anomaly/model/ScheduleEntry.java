package com.pipeline.anomaly.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 调度条目：外部调度器中一个 (管道, 任务类型) 的定时触发定义。
 * 以 name 为键进行幂等的写入与删除。
 */
public class ScheduleEntry implements Serializable {
    private final String name;
    private final String pipelineName;
    private final TaskKind taskKind;
    private final String cronExpression;
    private final boolean enabled;

    public ScheduleEntry(String name, String pipelineName, TaskKind taskKind,
                         String cronExpression, boolean enabled) {
        this.name = name;
        this.pipelineName = pipelineName;
        this.taskKind = taskKind;
        this.cronExpression = cronExpression;
        this.enabled = enabled;
    }

    /**
     * 为管道的某类任务创建启用状态的调度条目。
     */
    public static ScheduleEntry forTask(String pipelineName, TaskKind kind, String cronExpression) {
        return new ScheduleEntry(keyFor(pipelineName, kind), pipelineName, kind, cronExpression, true);
    }

    /** 调度条目键：pipeline_&lt;name&gt;_&lt;kind&gt; */
    public static String keyFor(String pipelineName, TaskKind kind) {
        return "pipeline_" + pipelineName + "_" + kind.getValue();
    }

    public String getName() { return name; }
    public String getPipelineName() { return pipelineName; }
    public TaskKind getTaskKind() { return taskKind; }
    public String getCronExpression() { return cronExpression; }
    public boolean isEnabled() { return enabled; }

    public String getTaskName() {
        return taskKind.getTaskName();
    }

    /** 任务调用参数，固定为管道名 */
    public List<String> getArgs() {
        return Collections.singletonList(pipelineName);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScheduleEntry)) return false;
        ScheduleEntry that = (ScheduleEntry) o;
        return enabled == that.enabled
                && Objects.equals(name, that.name)
                && Objects.equals(pipelineName, that.pipelineName)
                && taskKind == that.taskKind
                && Objects.equals(cronExpression, that.cronExpression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, pipelineName, taskKind, cronExpression, enabled);
    }

    @Override
    public String toString() {
        return "ScheduleEntry{name='" + name + "', task=" + getTaskName()
                + ", cron='" + cronExpression + "', enabled=" + enabled + "}";
    }
}
