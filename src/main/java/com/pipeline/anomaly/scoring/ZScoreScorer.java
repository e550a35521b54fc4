package com.pipeline.anomaly.scoring;

import com.pipeline.anomaly.core.AnomalyScorer;
import com.pipeline.anomaly.core.ScoringContext;
import com.pipeline.anomaly.model.AlignedPoint;
import com.pipeline.anomaly.model.AnomalyConfig;
import com.pipeline.anomaly.model.AnomalyScore;
import com.pipeline.anomaly.model.AnomalyTechnique;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Z分数评分。
 * score = min(1, |actual − mean| / (threshold × std))，std 取自此前滚动窗口内的残差，
 * 而不是原始值。score 达到1判定为异常。
 *
 * 历史残差不足 {@link ResidualStatistics#MIN_HISTORY} 个时该点记0分。
 */
public class ZScoreScorer implements AnomalyScorer {

    private static final Logger log = LoggerFactory.getLogger(ZScoreScorer.class);

    @Override
    public AnomalyTechnique getTechnique() {
        return AnomalyTechnique.Z_SCORE;
    }

    @Override
    public List<AnomalyScore> score(ScoringContext context) {
        AnomalyConfig config = context.getConfig();
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
            double std = ResidualStatistics.std(history);
            double s = score(Math.abs(p.getActual() - predicted), std, config.getThreshold());
            scores.add(new AnomalyScore(p.getTimestamp(), p.getActual(), predicted, s, s >= 1.0));
        }
        log.debug("Pipeline '{}': z-score computed for {} points.", context.getPipelineName(), scores.size());
        return scores;
    }

    /**
     * 标准差为0时任何偏差都记满分
     */
    public static double score(double deviation, double std, double threshold) {
        if (std <= 0.0) {
            return deviation > 0.0 ? 1.0 : 0.0;
        }
        return Math.min(1.0, deviation / (threshold * std));
    }
}
