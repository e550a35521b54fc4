package com.pipeline.anomaly;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

import java.nio.file.Path;
import java.util.Properties;
import java.util.Set;
import java.util.UUID;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.quartz.JobKey;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.impl.StdSchedulerFactory;

import com.pipeline.anomaly.core.ModelProvider;
import com.pipeline.anomaly.core.TimeSeriesStoreProvider;
import com.pipeline.anomaly.exception.ConfigurationException;
import com.pipeline.anomaly.exception.PortUnavailableException;
import com.pipeline.anomaly.model.Pipeline;
import com.pipeline.anomaly.model.ScheduleEntry;
import com.pipeline.anomaly.scheduler.QuartzSchedulerBackend;
import com.pipeline.anomaly.storage.SQLiteConfigurationStore;

public class AnomalyApplicationTest {

    @TempDir
    Path tempDir;

    private Scheduler scheduler;
    private SQLiteConfigurationStore store;
    private AnomalyApplication app;

    @BeforeEach
    public void setUp() throws SchedulerException {
        Properties props = new Properties();
        props.setProperty("org.quartz.scheduler.instanceName", "app-" + UUID.randomUUID());
        props.setProperty("org.quartz.threadPool.threadCount", "1");
        scheduler = new StdSchedulerFactory(props).getScheduler();
        store = new SQLiteConfigurationStore(tempDir.resolve("pipelines.db").toString());
        app = new AnomalyApplication(EngineConfig.fromProperties(new Properties()),
                mock(ModelProvider.class), mock(TimeSeriesStoreProvider.class));
    }

    @AfterEach
    public void tearDown() {
        app.shutdown();
    }

    private JobKey job(String name) {
        return new JobKey(name, QuartzSchedulerBackend.GROUP);
    }

    @Test
    public void testStoredPipelinesAreScheduledOnStart() throws SchedulerException {
        store.save(TestData.pipeline());

        app.start(store, scheduler);

        assertTrue(scheduler.isStarted());
        assertTrue(scheduler.checkExists(job("pipeline_cpu_forecast")));
        assertTrue(scheduler.checkExists(job("pipeline_cpu_anomaly")));
        assertNotNull(scheduler.getContext().get(QuartzSchedulerBackend.RUNNER_CONTEXT_KEY));
    }

    @Test
    public void testSaveAndDeletePipeline() throws SchedulerException {
        app.start(store, scheduler);

        Set<ScheduleEntry> entries = app.savePipeline(TestData.pipeline());

        assertEquals(2, entries.size());
        assertNotNull(store.get("cpu"));
        assertTrue(scheduler.checkExists(job("pipeline_cpu_forecast")));

        assertTrue(app.deletePipeline("cpu"));
        assertFalse(scheduler.checkExists(job("pipeline_cpu_forecast")));
        assertFalse(app.deletePipeline("cpu"));
    }

    @Test
    public void testInvalidPipelineIsNotSaved() {
        app.start(store, scheduler);
        Pipeline pipeline = TestData.pipeline();
        pipeline.setAnomalySchedule("every minute");

        assertThrows(ConfigurationException.class, () -> app.savePipeline(pipeline));
        assertTrue(store.list().isEmpty());
    }

    @Test
    public void testSchedulerPropertiesFromClasspath() {
        Properties props = AnomalyApplication.loadSchedulerProperties("quartz.properties");

        assertEquals("org.quartz.simpl.RAMJobStore", props.getProperty("org.quartz.jobStore.class"));
        assertThrows(PortUnavailableException.class,
                () -> AnomalyApplication.loadSchedulerProperties("missing-quartz.properties"));
    }
}
