package com.pipeline.anomaly.scoring;

import com.pipeline.anomaly.core.AnomalyScorer;
import com.pipeline.anomaly.core.ScoringContext;
import com.pipeline.anomaly.model.AlignedPoint;
import com.pipeline.anomaly.model.AnomalyConfig;
import com.pipeline.anomaly.model.AnomalyScore;
import com.pipeline.anomaly.model.AnomalyTechnique;

import java.util.ArrayList;
import java.util.List;

/**
 * 四分位距评分。
 * 在此前滚动窗口的残差上求 Q1、Q3，带 = [Q1 − t·IQR, Q3 + t·IQR]；当前残差落在带外即为异常。
 * score = min(1, 带外距离 / IQR)，IQR 为0时带外记满分。
 */
public class IqrScorer implements AnomalyScorer {

    @Override
    public AnomalyTechnique getTechnique() {
        return AnomalyTechnique.IQR;
    }

    @Override
    public List<AnomalyScore> score(ScoringContext context) {
        AnomalyConfig config = context.getConfig();
        double t = config.getThreshold();
        List<AlignedPoint> points = context.getPoints();
        List<AnomalyScore> scores = new ArrayList<>(points.size());

        for (int i = 0; i < points.size(); i++) {
            AlignedPoint p = points.get(i);
            double predicted = p.getPredicted().getMean();
            double[] history = ResidualStatistics.precedingResiduals(points, i, config.getResidualWindow());
            if (history.length < ResidualStatistics.MIN_HISTORY) {
                scores.add(new AnomalyScore(p.getTimestamp(), p.getActual(), predicted, 0.0, false));
                continue;
            }
            double q1 = ResidualStatistics.quantile(history, 0.25);
            double q3 = ResidualStatistics.quantile(history, 0.75);
            double iqr = q3 - q1;
            double lower = q1 - t * iqr;
            double upper = q3 + t * iqr;

            double residual = p.getResidual();
            double distance = 0.0;
            if (residual < lower) {
                distance = lower - residual;
            } else if (residual > upper) {
                distance = residual - upper;
            }
            boolean anomaly = distance > 0.0;
            double s;
            if (!anomaly) {
                s = 0.0;
            } else if (iqr <= 0.0) {
                s = 1.0;
            } else {
                s = Math.min(1.0, distance / iqr);
            }
            scores.add(new AnomalyScore(p.getTimestamp(), p.getActual(), predicted, s, anomaly));
        }
        return scores;
    }
}
