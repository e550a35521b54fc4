package com.pipeline.anomaly.storage;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.pipeline.anomaly.TestData;
import com.pipeline.anomaly.exception.ConfigurationException;
import com.pipeline.anomaly.model.AnomalyTechnique;
import com.pipeline.anomaly.model.CovariateConfig;
import com.pipeline.anomaly.model.Pipeline;
import com.pipeline.anomaly.model.PipelineMode;
import com.pipeline.anomaly.model.SeriesType;
import com.pipeline.anomaly.model.TrainingConfig;

public class SQLiteConfigurationStoreTest {

    @TempDir
    Path tempDir;

    private String dbPath;
    private SQLiteConfigurationStore store;

    @BeforeEach
    public void setUp() {
        dbPath = tempDir.resolve("nested/pipelines.db").toString();
        store = new SQLiteConfigurationStore(dbPath);
    }

    @AfterEach
    public void tearDown() {
        store.close();
    }

    @Test
    public void testSaveAndGetPreservesDefinition() {
        Pipeline pipeline = TestData.pipeline();
        pipeline.setMode(PipelineMode.ANOMALY_ONLY);
        pipeline.setSeriesType(SeriesType.COVARIATE);
        CovariateConfig covariate = new CovariateConfig();
        covariate.setName("load");
        covariate.setQuery("node_load1");
        pipeline.setCovariates(Collections.singletonList(covariate));
        pipeline.getAnomaly().setTechnique(AnomalyTechnique.Z_SCORE);
        TrainingConfig training = new TrainingConfig();
        training.setWindow("7d");
        pipeline.setTraining(training);

        store.save(pipeline);
        Pipeline loaded = store.get("cpu");

        assertEquals("up", loaded.getQuery());
        assertEquals(PipelineMode.ANOMALY_ONLY, loaded.getMode());
        assertEquals(SeriesType.COVARIATE, loaded.getSeriesType());
        assertEquals("node_load1", loaded.getCovariates().get(0).getQuery());
        assertEquals(AnomalyTechnique.Z_SCORE, loaded.getAnomaly().getTechnique());
        assertEquals("7d", loaded.getTraining().getWindow());
        assertEquals("chronos-small", loaded.getModel().getId());
    }

    @Test
    public void testGetMissingReturnsNull() {
        assertNull(store.get("missing"));
    }

    @Test
    public void testSaveOverwritesByName() {
        Pipeline pipeline = TestData.pipeline();
        store.save(pipeline);
        pipeline.setQuery("node_cpu_seconds_total");
        store.save(pipeline);

        List<Pipeline> all = store.list();

        assertEquals(1, all.size());
        assertEquals("node_cpu_seconds_total", all.get(0).getQuery());
    }

    @Test
    public void testListIsOrderedByName() {
        store.save(new Pipeline("memory", "node_memory_Active_bytes"));
        store.save(new Pipeline("cpu", "up"));

        List<Pipeline> all = store.list();

        assertEquals("cpu", all.get(0).getName());
        assertEquals("memory", all.get(1).getName());
    }

    @Test
    public void testDelete() {
        store.save(TestData.pipeline());

        assertTrue(store.delete("cpu"));
        assertFalse(store.delete("cpu"));
        assertTrue(store.list().isEmpty());
    }

    @Test
    public void testDefinitionsSurviveReopen() {
        store.save(TestData.pipeline());
        store.close();

        store = new SQLiteConfigurationStore(dbPath);

        assertEquals("up", store.get("cpu").getQuery());
    }

    @Test
    public void testUnreadableDefinition() throws Exception {
        store.save(TestData.pipeline());
        try (Connection c = DriverManager.getConnection("jdbc:sqlite:" + dbPath);
             PreparedStatement stmt = c.prepareStatement(
                     "INSERT INTO pipelines (name, definition, updated_at) VALUES (?, ?, ?)")) {
            stmt.setString(1, "broken");
            stmt.setString(2, "{not json");
            stmt.setLong(3, 0L);
            stmt.executeUpdate();
        }

        assertThrows(ConfigurationException.class, () -> store.get("broken"));
        List<Pipeline> all = store.list();
        assertEquals(1, all.size());
        assertEquals("cpu", all.get(0).getName());
    }
}
