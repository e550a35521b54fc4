package com.pipeline.anomaly.scheduler;

import com.pipeline.anomaly.core.PipelineTaskRunner;
import com.pipeline.anomaly.core.SchedulerBackend;
import com.pipeline.anomaly.exception.PortUnavailableException;
import com.pipeline.anomaly.model.ScheduleEntry;
import com.pipeline.anomaly.model.TaskKind;
import com.pipeline.anomaly.util.CronSchedules;
import org.quartz.CronScheduleBuilder;
import org.quartz.JobBuilder;
import org.quartz.JobDataMap;
import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.Trigger;
import org.quartz.TriggerBuilder;
import org.quartz.TriggerKey;
import org.quartz.impl.matchers.GroupMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 基于Quartz的调度后端。
 *
 * 每个条目对应一个持久化Job和一个同名Cron触发器，按条目名幂等地替换或删除。
 * 集群部署时使用Quartz的JDBC JobStore（isClustered=true），
 * 同一触发点在集群内只会被一个节点获取，引擎本身不做选主。
 */
public class QuartzSchedulerBackend implements SchedulerBackend {

    private static final Logger log = LoggerFactory.getLogger(QuartzSchedulerBackend.class);

    public static final String GROUP = "pipelines";
    public static final String RUNNER_CONTEXT_KEY = "pipelineTaskRunner";

    static final String KEY_PIPELINE = "pipelineName";
    static final String KEY_TASK = "taskKind";
    static final String KEY_CRON = "cronExpression";

    private static final String PORT = "scheduler";

    private final Scheduler scheduler;

    public QuartzSchedulerBackend(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * 将任务入口放入调度器上下文，供 {@link PipelineTaskJob} 触发时取用
     */
    public void bindRunner(PipelineTaskRunner runner) {
        try {
            scheduler.getContext().put(RUNNER_CONTEXT_KEY, runner);
        } catch (SchedulerException e) {
            throw new PortUnavailableException(PORT, "bindRunner", e);
        }
    }

    @Override
    public void upsert(ScheduleEntry entry) {
        String quartzCron = CronSchedules.toQuartz(entry.getCronExpression());
        JobKey jobKey = new JobKey(entry.getName(), GROUP);
        TriggerKey triggerKey = new TriggerKey(entry.getName(), GROUP);

        JobDetail job = JobBuilder.newJob(PipelineTaskJob.class)
                .withIdentity(jobKey)
                .withDescription(entry.getTaskName())
                .usingJobData(KEY_PIPELINE, entry.getPipelineName())
                .usingJobData(KEY_TASK, entry.getTaskKind().getValue())
                .usingJobData(KEY_CRON, entry.getCronExpression())
                .storeDurably()
                .build();

        Trigger trigger = TriggerBuilder.newTrigger()
                .withIdentity(triggerKey)
                .forJob(job)
                .withSchedule(CronScheduleBuilder.cronSchedule(quartzCron)
                        .withMisfireHandlingInstructionDoNothing())
                .build();

        try {
            scheduler.scheduleJob(job, Collections.singleton(trigger), true);
            if (!entry.isEnabled()) {
                scheduler.pauseTrigger(triggerKey);
            }
            log.info("Schedule '{}' upserted: {} -> '{}'", entry.getName(), entry.getCronExpression(), quartzCron);
        } catch (SchedulerException e) {
            log.error("Failed to upsert schedule '{}': {}", entry.getName(), e.getMessage(), e);
            throw new PortUnavailableException(PORT, "upsert", e);
        }
    }

    @Override
    public void delete(String key) {
        try {
            if (scheduler.deleteJob(new JobKey(key, GROUP))) {
                log.info("Schedule '{}' deleted.", key);
            }
        } catch (SchedulerException e) {
            log.error("Failed to delete schedule '{}': {}", key, e.getMessage(), e);
            throw new PortUnavailableException(PORT, "delete", e);
        }
    }

    @Override
    public List<ScheduleEntry> list() {
        List<ScheduleEntry> entries = new ArrayList<>();
        try {
            for (JobKey jobKey : scheduler.getJobKeys(GroupMatcher.jobGroupEquals(GROUP))) {
                JobDetail job = scheduler.getJobDetail(jobKey);
                if (job == null) {
                    continue;
                }
                JobDataMap data = job.getJobDataMap();
                TriggerKey triggerKey = new TriggerKey(jobKey.getName(), GROUP);
                boolean enabled = scheduler.getTriggerState(triggerKey) != Trigger.TriggerState.PAUSED;
                entries.add(new ScheduleEntry(jobKey.getName(),
                        data.getString(KEY_PIPELINE),
                        TaskKind.fromValue(data.getString(KEY_TASK)),
                        data.getString(KEY_CRON),
                        enabled));
            }
        } catch (SchedulerException e) {
            log.error("Failed to list schedules: {}", e.getMessage(), e);
            throw new PortUnavailableException(PORT, "list", e);
        }
        return entries;
    }

    public void start() {
        try {
            scheduler.start();
            log.info("Scheduler '{}' started.", scheduler.getSchedulerName());
        } catch (SchedulerException e) {
            throw new PortUnavailableException(PORT, "start", e);
        }
    }

    public void shutdown() {
        try {
            scheduler.shutdown(true);
            log.info("Scheduler shut down.");
        } catch (SchedulerException e) {
            log.error("Failed to shut down scheduler: {}", e.getMessage(), e);
        }
    }
}
