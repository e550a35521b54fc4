package com.pipeline.anomaly.core.impl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.pipeline.anomaly.TestData;
import com.pipeline.anomaly.core.SchedulerBackend;
import com.pipeline.anomaly.exception.PortUnavailableException;
import com.pipeline.anomaly.model.Pipeline;
import com.pipeline.anomaly.model.ScheduleEntry;
import com.pipeline.anomaly.model.TaskKind;
import com.pipeline.anomaly.model.TrainingConfig;

public class DefaultScheduleSynchronizerTest {

    /** keyed store with call counters */
    static class RecordingBackend implements SchedulerBackend {
        final Map<String, ScheduleEntry> entries = new HashMap<>();
        int upserts;
        int deletes;

        @Override
        public void upsert(ScheduleEntry entry) {
            upserts++;
            entries.put(entry.getName(), entry);
        }

        @Override
        public void delete(String key) {
            deletes++;
            entries.remove(key);
        }

        @Override
        public List<ScheduleEntry> list() {
            return new ArrayList<>(entries.values());
        }
    }

    private RecordingBackend backend;
    private DefaultScheduleSynchronizer synchronizer;
    private Pipeline pipeline;

    @BeforeEach
    public void setUp() {
        backend = new RecordingBackend();
        synchronizer = new DefaultScheduleSynchronizer(backend);
        pipeline = TestData.pipeline();
    }

    @Test
    public void testEnabledTasksAreScheduled() {
        Set<ScheduleEntry> desired = synchronizer.reconcile(pipeline);

        assertEquals(2, desired.size());
        ScheduleEntry forecast = backend.entries.get("pipeline_cpu_forecast");
        assertEquals("*/5 * * * *", forecast.getCronExpression());
        assertEquals("openanomaly.tasks.run_forecast", forecast.getTaskName());
        assertEquals(Collections.singletonList("cpu"), forecast.getArgs());
        assertEquals("*/1 * * * *", backend.entries.get("pipeline_cpu_anomaly").getCronExpression());
        assertFalse(backend.entries.containsKey("pipeline_cpu_training"));
    }

    @Test
    public void testReconcileIsIdempotent() {
        Set<ScheduleEntry> first = synchronizer.reconcile(pipeline);
        Map<String, ScheduleEntry> afterFirst = new HashMap<>(backend.entries);
        int upsertsAfterFirst = backend.upserts;

        Set<ScheduleEntry> second = synchronizer.reconcile(pipeline);

        assertEquals(first, second);
        assertEquals(afterFirst, backend.entries);
        assertEquals(upsertsAfterFirst, backend.upserts);
    }

    @Test
    public void testDisabledPipelineDeletesInsteadOfUpserting() {
        synchronizer.reconcile(pipeline);
        int upserts = backend.upserts;

        pipeline.setEnabled(false);
        Set<ScheduleEntry> desired = synchronizer.reconcile(pipeline);

        assertTrue(pipeline.isForecastEnabled());
        assertTrue(desired.isEmpty());
        assertEquals(upserts, backend.upserts);
        assertFalse(backend.entries.containsKey("pipeline_cpu_forecast"));
        assertTrue(backend.entries.isEmpty());
    }

    @Test
    public void testTaskSwitchRemovesOnlyThatTask() {
        synchronizer.reconcile(pipeline);

        pipeline.setAnomalyEnabled(false);
        synchronizer.reconcile(pipeline);

        assertTrue(backend.entries.containsKey("pipeline_cpu_forecast"));
        assertFalse(backend.entries.containsKey("pipeline_cpu_anomaly"));
    }

    @Test
    public void testScheduleChangeIsUpserted() {
        synchronizer.reconcile(pipeline);
        pipeline.setForecastSchedule("*/10 * * * *");

        synchronizer.reconcile(pipeline);

        assertEquals("*/10 * * * *", backend.entries.get("pipeline_cpu_forecast").getCronExpression());
        assertEquals(3, backend.upserts);
    }

    @Test
    public void testTrainingScheduledWhenConfigured() {
        TrainingConfig training = new TrainingConfig();
        training.setSchedule("0 3 * * 0");
        pipeline.setTraining(training);

        synchronizer.reconcile(pipeline);

        ScheduleEntry entry = backend.entries.get(ScheduleEntry.keyFor("cpu", TaskKind.TRAINING));
        assertEquals("0 3 * * 0", entry.getCronExpression());
        assertEquals("openanomaly.tasks.train_model", entry.getTaskName());
    }

    @Test
    public void testUnparseableCronIsNotScheduled() {
        pipeline.setAnomalySchedule("every minute");

        Set<ScheduleEntry> desired = synchronizer.reconcile(pipeline);

        assertEquals(1, desired.size());
        assertFalse(backend.entries.containsKey("pipeline_cpu_anomaly"));
    }

    @Test
    public void testRemoveDeletesAllThreeKeys() {
        synchronizer.reconcile(pipeline);
        int deletes = backend.deletes;

        synchronizer.remove("cpu");

        assertTrue(backend.entries.isEmpty());
        assertEquals(deletes + 3, backend.deletes);
    }

    @Test
    public void testRemoveOfUnknownPipelineIsHarmless() {
        synchronizer.remove("missing");

        assertEquals(3, backend.deletes);
        assertEquals(0, backend.upserts);
    }

    @Test
    public void testBackendFailurePropagates() {
        SchedulerBackend failing = mock(SchedulerBackend.class);
        when(failing.list()).thenReturn(Collections.emptyList());
        doThrow(new PortUnavailableException("scheduler", "upsert", new RuntimeException("down")))
                .when(failing).upsert(any());

        assertThrows(PortUnavailableException.class,
                () -> new DefaultScheduleSynchronizer(failing).reconcile(pipeline));
    }
}
