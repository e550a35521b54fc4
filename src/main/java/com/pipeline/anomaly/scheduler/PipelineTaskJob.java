package com.pipeline.anomaly.scheduler;

import com.pipeline.anomaly.core.PipelineTaskRunner;
import com.pipeline.anomaly.model.TaskKind;
import org.quartz.DisallowConcurrentExecution;
import org.quartz.Job;
import org.quartz.JobDataMap;
import org.quartz.JobExecutionContext;
import org.quartz.JobExecutionException;
import org.quartz.SchedulerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Quartz触发时执行的Job，把 (任务类型, 管道名) 交给任务入口。
 * 同一条目不并发执行；失败交给Quartz记录，不立即重新触发。
 */
@DisallowConcurrentExecution
public class PipelineTaskJob implements Job {

    private static final Logger log = LoggerFactory.getLogger(PipelineTaskJob.class);

    @Override
    public void execute(JobExecutionContext context) throws JobExecutionException {
        JobDataMap data = context.getMergedJobDataMap();
        String pipelineName = data.getString(QuartzSchedulerBackend.KEY_PIPELINE);
        TaskKind kind = TaskKind.fromValue(data.getString(QuartzSchedulerBackend.KEY_TASK));

        PipelineTaskRunner runner;
        try {
            runner = (PipelineTaskRunner) context.getScheduler().getContext()
                    .get(QuartzSchedulerBackend.RUNNER_CONTEXT_KEY);
        } catch (SchedulerException e) {
            throw new JobExecutionException(e, false);
        }
        if (runner == null) {
            throw new JobExecutionException("No task runner bound to scheduler context");
        }

        try {
            runner.runTask(kind, pipelineName);
        } catch (Exception e) {
            log.error("{} task for pipeline '{}' failed: {}", kind, pipelineName, e.getMessage(), e);
            throw new JobExecutionException(e, false);
        }
    }
}
