package com.pipeline.anomaly.core.impl;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

import com.pipeline.anomaly.TestData;
import com.pipeline.anomaly.model.Pipeline;

public class ResultSeriesNamesTest {

    @Test
    public void testPlainSelector() {
        assertEquals("up", ResultSeriesNames.sourceName("up"));
        assertEquals("up", ResultSeriesNames.sourceName("up{job=\"a\"}"));
        assertEquals("node_cpu:rate5m", ResultSeriesNames.sourceName(" node_cpu:rate5m "));
    }

    @Test
    public void testFunctionWrappedSelector() {
        assertEquals("x", ResultSeriesNames.sourceName("rate(x{job=\"a\"}[5m])"));
        assertEquals("http_requests_total",
                ResultSeriesNames.sourceName("irate( http_requests_total[1m] offset 5m)"));
    }

    @Test
    public void testAggregationsAndGrouping() {
        assertEquals("x", ResultSeriesNames.sourceName("sum by (job) (rate(x[5m]))"));
        assertEquals("x", ResultSeriesNames.sourceName("sum(rate(x{instance=~\"a.*\"}[5m])) without (cpu)"));
        assertEquals("h_bucket",
                ResultSeriesNames.sourceName("histogram_quantile(0.9, sum by (le) (rate(h_bucket[5m])))"));
        assertEquals("errors", ResultSeriesNames.sourceName("topk(5, errors)"));
        assertEquals("errors", ResultSeriesNames.sourceName("count_values(\"value\", errors)"));
    }

    @Test
    public void testLabelValuesAreNotMistakenForNames() {
        assertEquals("m", ResultSeriesNames.sourceName("{job=\"rate(x}\"} or m"));
        assertEquals("m", ResultSeriesNames.sourceName("{job=\"a\"} or m"));
    }

    @Test
    public void testNoMetricName() {
        assertEquals("", ResultSeriesNames.sourceName(null));
        assertEquals("", ResultSeriesNames.sourceName("{__name__=\"up\"}"));
        assertEquals("", ResultSeriesNames.sourceName("vector(1)"));
    }

    @Test
    public void testSourceLabelUsesMetricName() {
        Pipeline pipeline = TestData.pipeline();
        pipeline.setQuery("rate(x{job=\"a\"}[5m])");
        assertEquals("openanomaly_cpu_forecast{pipeline=\"cpu\",source=\"x\",type=\"mean\"}",
                ResultSeriesNames.forecastMean(pipeline));
    }
}
