package com.pipeline.anomaly.scoring;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.junit.jupiter.api.Test;

import com.pipeline.anomaly.TestData;
import com.pipeline.anomaly.model.AlignedPoint;
import com.pipeline.anomaly.model.AnomalyConfig;
import com.pipeline.anomaly.model.AnomalyScore;
import com.pipeline.anomaly.model.ForecastPoint;

public class ConfidenceIntervalScorerTest {

    private final ConfidenceIntervalScorer scorer = new ConfidenceIntervalScorer();
    private final AnomalyConfig config = new AnomalyConfig();

    @Test
    public void testBandLevels() {
        assertArrayEquals(new double[] { 0.025, 0.975 }, ConfidenceIntervalScorer.bandLevels(0.95), 1e-12);
        assertArrayEquals(new double[] { 0.1, 0.9 }, ConfidenceIntervalScorer.bandLevels(0.8), 1e-12);
    }

    @Test
    public void testInsideBandIsNormal() {
        List<AnomalyScore> scores = scorer.score(ScoringFixtures.context(config,
                Collections.singletonList(ScoringFixtures.banded(0, 11.0, 10.0, 8.0, 12.0))));

        assertEquals(0.0, scores.get(0).getScore(), 1e-12);
        assertFalse(scores.get(0).isAnomaly());
    }

    @Test
    public void testDistanceOutsideBandIsNormalizedAndClipped() {
        List<AnomalyScore> scores = scorer.score(ScoringFixtures.context(config, Arrays.asList(
                ScoringFixtures.banded(0, 7.0, 10.0, 8.0, 12.0),
                ScoringFixtures.banded(1, 30.0, 10.0, 8.0, 12.0))));

        assertEquals(0.25, scores.get(0).getScore(), 1e-12);
        assertTrue(scores.get(0).isAnomaly());
        assertEquals(1.0, scores.get(1).getScore(), 1e-12);
        assertTrue(scores.get(1).isAnomaly());
    }

    @Test
    public void testNearestAvailableQuantilesAreUsed() {
        Instant ts = TestData.NOW;
        Map<Double, Double> q = new TreeMap<>();
        q.put(0.1, 9.0);
        q.put(0.5, 10.0);
        q.put(0.9, 11.0);
        AlignedPoint p = new AlignedPoint(ts, 11.5, new ForecastPoint(ts, 10.0, q));

        AnomalyScore score = scorer.score(ScoringFixtures.context(config, Collections.singletonList(p))).get(0);

        // band falls back to [q_0.1, q_0.9] = [9, 11]
        assertTrue(score.isAnomaly());
        assertEquals(0.25, score.getScore(), 1e-12);
    }

    @Test
    public void testPointsWithoutQuantilesAreSkipped() {
        List<AlignedPoint> points = ScoringFixtures.withResiduals(0, 1);

        assertTrue(scorer.score(ScoringFixtures.context(config, points)).isEmpty());
    }

    @Test
    public void testZeroWidthBandScoresFull() {
        AnomalyScore score = scorer.score(ScoringFixtures.context(config,
                Collections.singletonList(ScoringFixtures.banded(0, 10.5, 10.0, 10.0, 10.0)))).get(0);

        assertEquals(1.0, score.getScore(), 1e-12);
        assertTrue(score.isAnomaly());
    }
}
