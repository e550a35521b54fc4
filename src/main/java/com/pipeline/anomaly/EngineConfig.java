package com.pipeline.anomaly;

import com.pipeline.anomaly.model.Pipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * 引擎配置。
 * 对应配置文件中的全局参数，启动时显式传给各端口的构造器，核心代码中没有全局可变配置。
 */
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    // ---- 时序存储 ----
    private String storeReadUrl = "http://localhost:9090";
    private String storeWriteUrl = "http://localhost:9090/api/v1/write";
    private long storeTimeoutMs = 30_000;

    // ---- 预测模型 ----
    private long modelTimeoutMs = 120_000;
    /** 训练得到新模型后是否写回 model.id */
    private boolean updateModelIdAfterTraining = true;

    // ---- 配置存储 ----
    private String configStorePath = "data/pipelines.db";

    // ---- 事件 ----
    private String eventsBootstrapServers = "localhost:9092";

    // ---- 调度 ----
    /** Quartz配置文件；文件系统中不存在时按classpath资源查找 */
    private String schedulerProperties = "quartz.properties";

    public static EngineConfig load(String configPath) {
        Properties props = new Properties();
        try (InputStream in = new FileInputStream(configPath)) {
            props.load(in);
        } catch (IOException e) {
            log.warn("Failed to load config from {}, using defaults. Error: {}", configPath, e.getMessage());
        }
        return fromProperties(props);
    }

    public static EngineConfig fromProperties(Properties props) {
        EngineConfig config = new EngineConfig();
        config.storeReadUrl = props.getProperty("store.read.url", config.storeReadUrl);
        config.storeWriteUrl = props.getProperty("store.write.url", config.storeWriteUrl);
        config.storeTimeoutMs = Long.parseLong(
                props.getProperty("store.timeout.ms", String.valueOf(config.storeTimeoutMs)));
        config.modelTimeoutMs = Long.parseLong(
                props.getProperty("model.timeout.ms", String.valueOf(config.modelTimeoutMs)));
        config.updateModelIdAfterTraining = Boolean.parseBoolean(
                props.getProperty("training.update.model.id", String.valueOf(config.updateModelIdAfterTraining)));
        config.configStorePath = props.getProperty("config.store.path", config.configStorePath);
        config.eventsBootstrapServers = props.getProperty("events.bootstrap.servers", config.eventsBootstrapServers);
        config.schedulerProperties = props.getProperty("scheduler.properties", config.schedulerProperties);
        return config;
    }

    /**
     * 管道覆盖项优先，否则取全局地址
     */
    public String resolveReadUrl(Pipeline pipeline) {
        String override = pipeline.getStoreReadUrl();
        return (override != null && !override.isBlank()) ? override : storeReadUrl;
    }

    public String resolveWriteUrl(Pipeline pipeline) {
        String override = pipeline.getStoreWriteUrl();
        return (override != null && !override.isBlank()) ? override : storeWriteUrl;
    }

    // ---- Getters ----
    public String getStoreReadUrl() { return storeReadUrl; }
    public String getStoreWriteUrl() { return storeWriteUrl; }
    public long getStoreTimeoutMs() { return storeTimeoutMs; }
    public long getModelTimeoutMs() { return modelTimeoutMs; }
    public boolean isUpdateModelIdAfterTraining() { return updateModelIdAfterTraining; }
    public String getConfigStorePath() { return configStorePath; }
    public String getEventsBootstrapServers() { return eventsBootstrapServers; }
    public String getSchedulerProperties() { return schedulerProperties; }

    @Override
    public String toString() {
        return "EngineConfig{storeRead='" + storeReadUrl + "'"
                + ", storeWrite='" + storeWriteUrl + "'"
                + ", storeTimeout=" + storeTimeoutMs + "ms"
                + ", modelTimeout=" + modelTimeoutMs + "ms"
                + ", configStore='" + configStorePath + "'"
                + ", events='" + eventsBootstrapServers + "'}";
    }
}
