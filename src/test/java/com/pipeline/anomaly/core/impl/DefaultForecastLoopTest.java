package com.pipeline.anomaly.core.impl;

import static com.pipeline.anomaly.TestData.NOW;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.MockitoAnnotations;

import com.pipeline.anomaly.TestData;
import com.pipeline.anomaly.core.ForecastingModel;
import com.pipeline.anomaly.core.TimeSeriesStore;
import com.pipeline.anomaly.exception.ConfigurationException;
import com.pipeline.anomaly.exception.DataInsufficiencyException;
import com.pipeline.anomaly.exception.InvalidForecastException;
import com.pipeline.anomaly.model.CovariateConfig;
import com.pipeline.anomaly.model.ForecastPoint;
import com.pipeline.anomaly.model.ForecastRequest;
import com.pipeline.anomaly.model.ForecastResult;
import com.pipeline.anomaly.model.Pipeline;
import com.pipeline.anomaly.model.SeriesType;
import com.pipeline.anomaly.model.TimeSeriesRow;

public class DefaultForecastLoopTest {

    private TimeSeriesStore store;
    private ForecastingModel model;
    private PortCallExecutor executor;
    private DefaultForecastLoop loop;
    private Pipeline pipeline;
    private AutoCloseable mocks;

    @Captor
    private ArgumentCaptor<List<TimeSeriesRow>> rowsCaptor;

    @BeforeEach
    public void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        store = mock(TimeSeriesStore.class);
        model = mock(ForecastingModel.class);
        executor = new PortCallExecutor(5_000, 5_000);
        loop = new DefaultForecastLoop(store, model, executor);
        pipeline = TestData.pipeline();
    }

    @AfterEach
    public void tearDown() throws Exception {
        executor.close();
        mocks.close();
    }

    private void givenContext(List<TimeSeriesRow> rows) {
        when(store.queryRange(eq("up"), any(), any(), eq("1m"))).thenReturn(rows);
    }

    @Test
    public void testPredictionLengthFromHorizonAndStep() {
        assertEquals(15, DefaultForecastLoop.predictionLength(pipeline));
    }

    @Test
    public void testContextWindowRequested() {
        givenContext(Collections.emptyList());
        loop.generateForecast(pipeline, NOW);
        verify(store).queryRange("up", NOW.minusSeconds(3600), NOW, "1m");
    }

    @Test
    public void testEmptyContextSkipsModel() {
        givenContext(Collections.emptyList());

        ForecastResult result = loop.generateForecast(pipeline, NOW);

        assertTrue(result.isEmpty());
        verifyNoInteractions(model);
    }

    @Test
    public void testSingleRowIsInsufficient() {
        givenContext(TestData.series("up", NOW.minusSeconds(60), 1, i -> 1.0));

        assertThrows(DataInsufficiencyException.class, () -> loop.generateForecast(pipeline, NOW));
        verifyNoInteractions(model);
    }

    @Test
    public void testHorizonShorterThanStepFailsBeforeFetching() {
        pipeline.setPredictionHorizon("30s");

        assertThrows(ConfigurationException.class, () -> loop.generateForecast(pipeline, NOW));
        verifyNoInteractions(store, model);
    }

    @Test
    public void testRequestCarriesLengthQuantilesAndParameters() {
        pipeline.getModel().getParameters().put("num_samples", 20);
        givenContext(TestData.series("up", NOW.minusSeconds(3600), 60, i -> i));
        when(model.predict(anyList(), any())).thenReturn(TestData.forecast(NOW, 15, i -> 60 + i, 2.0));

        ForecastResult result = loop.generateForecast(pipeline, NOW);

        ArgumentCaptor<ForecastRequest> captor = ArgumentCaptor.forClass(ForecastRequest.class);
        verify(model).predict(anyList(), captor.capture());
        ForecastRequest request = captor.getValue();
        assertEquals(15, request.getPredictionLength());
        assertEquals(DefaultForecastLoop.DEFAULT_QUANTILES, request.getQuantileLevels());
        assertEquals(20, request.getParameters().get("num_samples"));

        assertEquals(15, result.size());
        assertEquals("up", result.getSeriesId());
    }

    @Test
    public void testConfiguredQuantilesReplaceDefaults() {
        pipeline.getModel().setQuantileLevels(Arrays.asList(0.9, 0.1));
        givenContext(TestData.series("up", NOW.minusSeconds(3600), 60, i -> i));
        when(model.predict(anyList(), any())).thenReturn(TestData.forecast(NOW, 15, i -> 1.0, 1.0));

        loop.generateForecast(pipeline, NOW, Arrays.asList(0.025, 0.975));

        ArgumentCaptor<ForecastRequest> captor = ArgumentCaptor.forClass(ForecastRequest.class);
        verify(model).predict(anyList(), captor.capture());
        assertEquals(Arrays.asList(0.025, 0.1, 0.9, 0.975), captor.getValue().getQuantileLevels());
    }

    @Test
    public void testLongResultIsTruncated() {
        givenContext(TestData.series("up", NOW.minusSeconds(3600), 60, i -> i));
        when(model.predict(anyList(), any())).thenReturn(TestData.forecast(NOW, 20, i -> 1.0, 1.0));

        assertEquals(15, loop.generateForecast(pipeline, NOW).size());
    }

    @Test
    public void testShortResultIsRejected() {
        givenContext(TestData.series("up", NOW.minusSeconds(3600), 60, i -> i));
        when(model.predict(anyList(), any())).thenReturn(TestData.forecast(NOW, 3, i -> 1.0, 1.0));

        assertThrows(InvalidForecastException.class, () -> loop.runForecast(pipeline, NOW));
        verify(store, never()).write(anyList());
    }

    @Test
    public void testResultNotSpacedAtStepIsRejected() {
        givenContext(TestData.series("up", NOW.minusSeconds(3600), 60, i -> i));
        List<ForecastPoint> hourly = new ArrayList<>();
        for (int i = 0; i < 15; i++) {
            hourly.add(new ForecastPoint(NOW.plusSeconds(3600L * (i + 1)), 1.0, Collections.emptyMap()));
        }
        when(model.predict(anyList(), any())).thenReturn(new ForecastResult(null, hourly));

        assertThrows(InvalidForecastException.class, () -> loop.runForecast(pipeline, NOW));
        verify(store, never()).write(anyList());
    }

    @Test
    public void testEmptyModelResultWritesNothing() {
        givenContext(TestData.series("up", NOW.minusSeconds(3600), 60, i -> i));
        when(model.predict(anyList(), any())).thenReturn(ForecastResult.empty());

        loop.runForecast(pipeline, NOW);

        verify(store, never()).write(anyList());
    }

    @Test
    public void testRunForecastWritesMeanAndQuantileSeries() {
        givenContext(TestData.series("up", NOW.minusSeconds(3600), 60, i -> i));
        when(model.predict(anyList(), any())).thenReturn(TestData.forecast(NOW, 15, i -> 10.0, 4.0));

        loop.runForecast(pipeline, NOW);

        verify(store).write(rowsCaptor.capture());
        List<TimeSeriesRow> written = rowsCaptor.getValue();
        // 15 points x (mean + 4 quantiles)
        assertEquals(75, written.size());

        Set<String> ids = written.stream().map(TimeSeriesRow::getSeriesId).collect(Collectors.toSet());
        assertTrue(ids.contains("openanomaly_cpu_forecast{pipeline=\"cpu\",source=\"up\",type=\"mean\"}"));
        assertTrue(ids.contains("openanomaly_cpu_forecast{pipeline=\"cpu\",quantile=\"0.975\",source=\"up\"}"));
        assertTrue(ids.contains("openanomaly_cpu_forecast{pipeline=\"cpu\",quantile=\"0.1\",source=\"up\"}"));
        assertEquals(5, ids.size());
    }

    @Test
    public void testWriteDisabledSkipsStoreWrite() {
        pipeline.getOutput().setWriteForecast(false);
        givenContext(TestData.series("up", NOW.minusSeconds(3600), 60, i -> i));
        when(model.predict(anyList(), any())).thenReturn(TestData.forecast(NOW, 15, i -> 1.0, 1.0));

        loop.runForecast(pipeline, NOW);

        verify(store, never()).write(anyList());
    }

    @Test
    public void testCovariatesAreAppendedUnderTheirName() {
        pipeline.setSeriesType(SeriesType.COVARIATE);
        pipeline.getCovariates().add(new CovariateConfig("node_memory_bytes", "memory"));
        givenContext(TestData.series("up", NOW.minusSeconds(3600), 60, i -> i));
        when(store.queryRange(eq("node_memory_bytes"), any(), any(), eq("1m")))
                .thenReturn(TestData.series("node_memory_bytes{instance=\"a\"}", NOW.minusSeconds(3600), 60, i -> 5));
        when(model.predict(anyList(), any())).thenReturn(TestData.forecast(NOW, 15, i -> 1.0, 1.0));

        ForecastResult result = loop.generateForecast(pipeline, NOW);

        verify(model).predict(rowsCaptor.capture(), any());
        List<TimeSeriesRow> input = rowsCaptor.getValue();
        assertEquals(120, input.size());
        assertEquals(60, input.stream().filter(r -> "memory".equals(r.getSeriesId())).count());
        assertEquals("up", result.getSeriesId());
    }

    @Test
    public void testUnivariateForecastsFirstSeriesOnly() {
        List<TimeSeriesRow> rows = new ArrayList<>(TestData.series("up{job=\"b\"}", NOW.minusSeconds(3600), 60, i -> 2));
        rows.addAll(TestData.series("up{job=\"a\"}", NOW.minusSeconds(3600), 60, i -> 1));
        givenContext(rows);
        when(model.predict(anyList(), any())).thenReturn(TestData.forecast(NOW, 15, i -> 1.0, 1.0));

        ForecastResult result = loop.generateForecast(pipeline, NOW);

        verify(model).predict(rowsCaptor.capture(), any());
        assertEquals(60, rowsCaptor.getValue().size());
        assertEquals("up{job=\"a\"}", result.getSeriesId());
        Instant first = rowsCaptor.getValue().get(0).getTimestamp();
        assertEquals(NOW.minusSeconds(3600), first);
    }

    @Test
    public void testMultivariatePassesAllSeries() {
        pipeline.setSeriesType(SeriesType.MULTIVARIATE);
        List<TimeSeriesRow> rows = new ArrayList<>(TestData.series("up{job=\"b\"}", NOW.minusSeconds(3600), 60, i -> 2));
        rows.addAll(TestData.series("up{job=\"a\"}", NOW.minusSeconds(3600), 60, i -> 1));
        givenContext(rows);
        when(model.predict(anyList(), any())).thenReturn(TestData.forecast(NOW, 15, i -> 1.0, 1.0));

        loop.generateForecast(pipeline, NOW);

        verify(model).predict(rowsCaptor.capture(), any());
        assertEquals(120, rowsCaptor.getValue().size());
    }
}
