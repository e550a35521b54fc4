package com.pipeline.anomaly.core;

import com.pipeline.anomaly.model.AnomalyTechnique;

import java.util.Set;

/**
 * 评分器注册表。每种异常检测方法最多注册一个评分器。
 */
public interface ScorerManager {

    /**
     * @return 注册是否成功（评分器为空或该方法已注册时返回false）
     */
    boolean registerScorer(AnomalyScorer scorer);

    boolean unregisterScorer(AnomalyTechnique technique);

    /**
     * @return 评分器；未注册返回null
     */
    AnomalyScorer getScorer(AnomalyTechnique technique);

    Set<AnomalyTechnique> getRegisteredTechniques();
}
