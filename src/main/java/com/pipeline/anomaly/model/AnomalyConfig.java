package com.pipeline.anomaly.model;

import java.io.Serializable;

/**
 * 异常检测配置
 */
public class AnomalyConfig implements Serializable {
    private AnomalyTechnique technique = AnomalyTechnique.CONFIDENCE_INTERVAL;
    /** 置信区间方法使用的置信水平，取值 (0,1) */
    private double confidenceLevel = 0.95;
    /** z_score / iqr 方法的判定倍数 */
    private double threshold = 3.0;
    /** 计算残差统计量时回看的点数 */
    private int residualWindow = 30;

    public AnomalyConfig() {}

    public AnomalyConfig(AnomalyTechnique technique, double confidenceLevel, double threshold) {
        this.technique = technique;
        this.confidenceLevel = confidenceLevel;
        this.threshold = threshold;
    }

    public AnomalyTechnique getTechnique() { return technique; }
    public void setTechnique(AnomalyTechnique technique) { this.technique = technique; }
    public double getConfidenceLevel() { return confidenceLevel; }
    public void setConfidenceLevel(double confidenceLevel) { this.confidenceLevel = confidenceLevel; }
    public double getThreshold() { return threshold; }
    public void setThreshold(double threshold) { this.threshold = threshold; }
    public int getResidualWindow() { return residualWindow; }
    public void setResidualWindow(int residualWindow) { this.residualWindow = residualWindow; }
}
