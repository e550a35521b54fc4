package com.pipeline.anomaly.scoring;

import com.pipeline.anomaly.core.AnomalyScorer;
import com.pipeline.anomaly.core.ForecastingModel;
import com.pipeline.anomaly.core.ScoringContext;
import com.pipeline.anomaly.exception.UnsupportedTechniqueException;
import com.pipeline.anomaly.model.AnomalyScore;
import com.pipeline.anomaly.model.AnomalyTechnique;

import java.util.Collections;
import java.util.List;

/**
 * 孤立森林评分，完全委托给模型端口；模型不支持时直接失败。
 */
public class IsolationForestScorer implements AnomalyScorer {

    @Override
    public AnomalyTechnique getTechnique() {
        return AnomalyTechnique.ISOLATION_FOREST;
    }

    @Override
    public void checkSupported(String pipelineName, ForecastingModel model) {
        if (model == null || !model.supportsAnomalyDetection()) {
            throw new UnsupportedTechniqueException(AnomalyTechnique.ISOLATION_FOREST,
                    "Pipeline '" + pipelineName + "': model does not support isolation_forest anomaly detection");
        }
    }

    @Override
    public List<AnomalyScore> score(ScoringContext context) {
        ForecastingModel model = context.getModel();
        checkSupported(context.getPipelineName(), model);
        List<AnomalyScore> scores = context.getExecutor().callModel("detectAnomalies",
                () -> model.detectAnomalies(context.getActuals(), context.getForecast(), context.getConfig()));
        return scores != null ? scores : Collections.emptyList();
    }
}
