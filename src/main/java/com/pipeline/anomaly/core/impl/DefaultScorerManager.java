package com.pipeline.anomaly.core.impl;

import com.pipeline.anomaly.core.AnomalyScorer;
import com.pipeline.anomaly.core.ScorerManager;
import com.pipeline.anomaly.model.AnomalyTechnique;
import com.pipeline.anomaly.scoring.ConfidenceIntervalScorer;
import com.pipeline.anomaly.scoring.IqrScorer;
import com.pipeline.anomaly.scoring.IsolationForestScorer;
import com.pipeline.anomaly.scoring.ZScoreScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 评分器管理器默认实现。
 * 使用ConcurrentHashMap存储注册表，支持并发注册和查询。
 */
public class DefaultScorerManager implements ScorerManager {

    private static final Logger log = LoggerFactory.getLogger(DefaultScorerManager.class);

    /** 评分器注册表：technique -> AnomalyScorer实例 */
    private final ConcurrentHashMap<AnomalyTechnique, AnomalyScorer> registry = new ConcurrentHashMap<>();

    /**
     * 注册了全部内置评分器的管理器
     */
    public static DefaultScorerManager withBuiltinScorers() {
        DefaultScorerManager manager = new DefaultScorerManager();
        manager.registerScorer(new ConfidenceIntervalScorer());
        manager.registerScorer(new ZScoreScorer());
        manager.registerScorer(new IqrScorer());
        manager.registerScorer(new IsolationForestScorer());
        return manager;
    }

    @Override
    public boolean registerScorer(AnomalyScorer scorer) {
        if (scorer == null || scorer.getTechnique() == null) {
            log.error("Cannot register null scorer or scorer without technique");
            return false;
        }
        AnomalyTechnique technique = scorer.getTechnique();
        AnomalyScorer existing = registry.putIfAbsent(technique, scorer);
        if (existing != null) {
            log.warn("Scorer for '{}' is already registered, registration rejected.", technique);
            return false;
        }
        log.info("Scorer '{}' registered: {}", technique, scorer.getClass().getSimpleName());
        return true;
    }

    @Override
    public boolean unregisterScorer(AnomalyTechnique technique) {
        if (technique == null || registry.remove(technique) == null) {
            log.warn("Scorer '{}' not found, nothing to unregister.", technique);
            return false;
        }
        log.info("Scorer '{}' unregistered.", technique);
        return true;
    }

    @Override
    public AnomalyScorer getScorer(AnomalyTechnique technique) {
        return technique != null ? registry.get(technique) : null;
    }

    @Override
    public Set<AnomalyTechnique> getRegisteredTechniques() {
        if (registry.isEmpty()) {
            return Collections.emptySet();
        }
        return Collections.unmodifiableSet(EnumSet.copyOf(registry.keySet()));
    }
}
