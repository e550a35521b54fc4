package com.pipeline.anomaly.scoring;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.pipeline.anomaly.TestData;
import com.pipeline.anomaly.core.ForecastingModel;
import com.pipeline.anomaly.core.ScoringContext;
import com.pipeline.anomaly.core.impl.PortCallExecutor;
import com.pipeline.anomaly.exception.UnsupportedTechniqueException;
import com.pipeline.anomaly.model.AnomalyConfig;
import com.pipeline.anomaly.model.AnomalyScore;
import com.pipeline.anomaly.model.AnomalyTechnique;
import com.pipeline.anomaly.model.ForecastResult;

public class IsolationForestScorerTest {

    private final IsolationForestScorer scorer = new IsolationForestScorer();
    private final AnomalyConfig config = new AnomalyConfig(AnomalyTechnique.ISOLATION_FOREST, 0.95, 3.0);
    private ForecastingModel model;
    private PortCallExecutor executor;

    @BeforeEach
    public void setUp() {
        model = mock(ForecastingModel.class);
        executor = new PortCallExecutor(5_000, 5_000);
    }

    @AfterEach
    public void tearDown() {
        executor.close();
    }

    private ScoringContext context() {
        return new ScoringContext("cpu", config, ScoringFixtures.withResiduals(0, 1),
                Collections.emptyList(), ForecastResult.empty(), model, executor);
    }

    @Test
    public void testUnsupportedModelFails() {
        when(model.supportsAnomalyDetection()).thenReturn(false);

        UnsupportedTechniqueException e = assertThrows(UnsupportedTechniqueException.class,
                () -> scorer.score(context()));
        assertEquals(AnomalyTechnique.ISOLATION_FOREST, e.getTechnique());
        verify(model, never()).detectAnomalies(any(), any(), any());
    }

    @Test
    public void testSupportedModelIsDelegatedTo() {
        List<AnomalyScore> expected = Collections.singletonList(
                new AnomalyScore(TestData.NOW, 5.0, 1.0, 0.9, true));
        when(model.supportsAnomalyDetection()).thenReturn(true);
        when(model.detectAnomalies(any(), any(), any())).thenReturn(expected);

        assertSame(expected, scorer.score(context()));
    }
}
