package com.pipeline.anomaly;

import com.pipeline.anomaly.core.ConfigurationStore;
import com.pipeline.anomaly.core.ModelProvider;
import com.pipeline.anomaly.core.ScheduleSynchronizer;
import com.pipeline.anomaly.core.TimeSeriesStoreProvider;
import com.pipeline.anomaly.core.impl.DefaultPipelineTaskRunner;
import com.pipeline.anomaly.core.impl.DefaultScheduleSynchronizer;
import com.pipeline.anomaly.core.impl.DefaultScorerManager;
import com.pipeline.anomaly.core.impl.PipelineValidator;
import com.pipeline.anomaly.core.impl.PortCallExecutor;
import com.pipeline.anomaly.event.KafkaEventPublisherProvider;
import com.pipeline.anomaly.exception.PortUnavailableException;
import com.pipeline.anomaly.model.Pipeline;
import com.pipeline.anomaly.model.ScheduleEntry;
import com.pipeline.anomaly.scheduler.QuartzSchedulerBackend;
import com.pipeline.anomaly.storage.SQLiteConfigurationStore;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.impl.StdSchedulerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.util.Properties;
import java.util.Set;

/**
 * 引擎启动引导类。
 * 创建配置存储、调度后端和任务入口，按已存储的管道同步调度条目后启动调度。
 *
 * 模型与时序存储的具体实现不属于引擎，由宿主应用通过 ModelProvider / TimeSeriesStoreProvider 注入。
 * 保存与同步是两个显式的顺序调用：savePipeline 先校验、再保存、再同步调度。
 */
public class AnomalyApplication {

    private static final Logger log = LoggerFactory.getLogger(AnomalyApplication.class);

    private final EngineConfig config;
    private final ModelProvider modelProvider;
    private final TimeSeriesStoreProvider storeProvider;

    private ConfigurationStore configStore;
    private PortCallExecutor executor;
    private QuartzSchedulerBackend schedulerBackend;
    private ScheduleSynchronizer synchronizer;
    private DefaultPipelineTaskRunner taskRunner;

    public AnomalyApplication(EngineConfig config, ModelProvider modelProvider,
                              TimeSeriesStoreProvider storeProvider) {
        this.config = config;
        this.modelProvider = modelProvider;
        this.storeProvider = storeProvider;
    }

    public void start() {
        start(new SQLiteConfigurationStore(config.getConfigStorePath()), createScheduler(config));
    }

    /**
     * 使用给定的配置存储和（尚未启动的）Quartz调度器启动
     */
    public void start(ConfigurationStore store, Scheduler scheduler) {
        log.info("=== Pipeline Anomaly Engine ===");
        log.info("Starting with config: {}", config);

        // 1. 配置存储
        configStore = store;

        // 2. 端口调用执行器
        executor = new PortCallExecutor(config.getStoreTimeoutMs(), config.getModelTimeoutMs());

        // 3. 任务入口
        taskRunner = new DefaultPipelineTaskRunner(
                configStore,
                modelProvider,
                storeProvider,
                new KafkaEventPublisherProvider(config.getEventsBootstrapServers()),
                DefaultScorerManager.withBuiltinScorers(),
                executor,
                config,
                Clock.systemUTC()
        );

        // 4. 调度后端与同步器
        schedulerBackend = new QuartzSchedulerBackend(scheduler);
        schedulerBackend.bindRunner(taskRunner);
        synchronizer = new DefaultScheduleSynchronizer(schedulerBackend);

        // 5. 按已存储的管道同步调度
        int synced = 0;
        for (Pipeline pipeline : configStore.list()) {
            try {
                synchronizer.reconcile(pipeline);
                synced++;
            } catch (RuntimeException e) {
                log.error("Failed to reconcile schedules of pipeline '{}': {}",
                        pipeline.getName(), e.getMessage(), e);
            }
        }
        log.info("Reconciled schedules for {} pipelines.", synced);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown hook triggered, performing graceful shutdown...");
            shutdown();
        }, "shutdown-hook"));

        schedulerBackend.start();
        log.info("=== Engine started successfully ===");
    }

    /**
     * 校验 → 保存 → 同步调度
     *
     * @return 同步后应存在的调度条目
     */
    public Set<ScheduleEntry> savePipeline(Pipeline pipeline) {
        PipelineValidator.validateOrThrow(pipeline);
        configStore.save(pipeline);
        return synchronizer.reconcile(pipeline);
    }

    /**
     * 删除配置后移除全部调度条目；配置不存在时仍会清理调度
     */
    public boolean deletePipeline(String name) {
        boolean deleted = configStore.delete(name);
        synchronizer.remove(name);
        return deleted;
    }

    public DefaultPipelineTaskRunner getTaskRunner() { return taskRunner; }
    public ConfigurationStore getConfigStore() { return configStore; }

    public synchronized void shutdown() {
        if (schedulerBackend != null) {
            schedulerBackend.shutdown();
            schedulerBackend = null;
        }
        if (executor != null) {
            executor.close();
            executor = null;
        }
        if (configStore instanceof AutoCloseable) {
            try {
                ((AutoCloseable) configStore).close();
            } catch (Exception e) {
                log.warn("Error closing configuration store: {}", e.getMessage());
            }
            configStore = null;
        }
        log.info("=== Engine shut down ===");
    }

    static Scheduler createScheduler(EngineConfig config) {
        try {
            return new StdSchedulerFactory(loadSchedulerProperties(config.getSchedulerProperties())).getScheduler();
        } catch (SchedulerException e) {
            throw new PortUnavailableException("scheduler", "init", e);
        }
    }

    /**
     * 先查文件系统，再查classpath
     */
    static Properties loadSchedulerProperties(String location) {
        Properties props = new Properties();
        File file = new File(location);
        try (InputStream in = file.isFile()
                ? new FileInputStream(file)
                : AnomalyApplication.class.getClassLoader().getResourceAsStream(location)) {
            if (in == null) {
                throw new PortUnavailableException("scheduler", "init",
                        new IOException("Scheduler properties not found: " + location));
            }
            props.load(in);
        } catch (IOException e) {
            throw new PortUnavailableException("scheduler", "init", e);
        }
        return props;
    }
}
