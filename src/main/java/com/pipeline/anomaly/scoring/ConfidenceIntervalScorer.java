package com.pipeline.anomaly.scoring;

import com.pipeline.anomaly.core.AnomalyScorer;
import com.pipeline.anomaly.core.ScoringContext;
import com.pipeline.anomaly.model.AlignedPoint;
import com.pipeline.anomaly.model.AnomalyScore;
import com.pipeline.anomaly.model.AnomalyTechnique;
import com.pipeline.anomaly.model.ForecastPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 置信区间评分。
 *
 * 置信水平 c 对应分位数带 [q_(1−c)/2, q_1−(1−c)/2]，例如0.95对应 [q_0.025, q_0.975]；
 * 预测中没有精确水平时取最接近的已有分位数。
 * 落在带外即为异常，score = 带外距离 / 带宽，截断到 [0,1]。
 */
public class ConfidenceIntervalScorer implements AnomalyScorer {

    private static final Logger log = LoggerFactory.getLogger(ConfidenceIntervalScorer.class);

    @Override
    public AnomalyTechnique getTechnique() {
        return AnomalyTechnique.CONFIDENCE_INTERVAL;
    }

    @Override
    public List<AnomalyScore> score(ScoringContext context) {
        double[] band = bandLevels(context.getConfig().getConfidenceLevel());
        List<AnomalyScore> scores = new ArrayList<>();

        for (AlignedPoint p : context.getPoints()) {
            ForecastPoint predicted = p.getPredicted();
            Double loLevel = predicted.nearestQuantileLevel(band[0]);
            Double hiLevel = predicted.nearestQuantileLevel(band[1]);
            if (loLevel == null || hiLevel == null) {
                log.warn("Pipeline '{}': forecast at {} has no quantiles, skipping point.",
                        context.getPipelineName(), p.getTimestamp());
                continue;
            }
            double lo = predicted.getQuantile(loLevel);
            double hi = predicted.getQuantile(hiLevel);
            if (lo > hi) {
                double tmp = lo;
                lo = hi;
                hi = tmp;
            }
            double s = score(p.getActual(), lo, hi);
            boolean anomaly = p.getActual() < lo || p.getActual() > hi;
            scores.add(new AnomalyScore(p.getTimestamp(), p.getActual(), predicted.getMean(), s, anomaly));
        }
        return scores;
    }

    /**
     * 置信水平对应的上下分位数水平，保留6位小数
     */
    public static double[] bandLevels(double confidenceLevel) {
        double tail = (1.0 - confidenceLevel) / 2.0;
        return new double[]{round6(tail), round6(1.0 - tail)};
    }

    public static List<Double> bandLevelList(double confidenceLevel) {
        double[] band = bandLevels(confidenceLevel);
        return Arrays.asList(band[0], band[1]);
    }

    static double score(double actual, double lo, double hi) {
        double distance;
        if (actual < lo) {
            distance = lo - actual;
        } else if (actual > hi) {
            distance = actual - hi;
        } else {
            return 0.0;
        }
        double width = hi - lo;
        if (width <= 0.0) {
            return 1.0;
        }
        return Math.min(1.0, distance / width);
    }

    private static double round6(double v) {
        return Math.round(v * 1_000_000d) / 1_000_000d;
    }
}
