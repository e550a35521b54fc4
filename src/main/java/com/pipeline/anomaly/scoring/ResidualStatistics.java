package com.pipeline.anomaly.scoring;

import com.pipeline.anomaly.model.AlignedPoint;

import java.util.Arrays;
import java.util.List;

/**
 * 残差（实际值 − 预测均值）上的滚动统计
 */
public final class ResidualStatistics {

    /** 滚动窗口内至少需要的历史残差个数 */
    public static final int MIN_HISTORY = 2;

    private ResidualStatistics() {}

    /**
     * 第 index 个点之前（不含自身）最多 window 个残差
     */
    public static double[] precedingResiduals(List<AlignedPoint> points, int index, int window) {
        int start = Math.max(0, index - window);
        double[] residuals = new double[index - start];
        for (int j = start; j < index; j++) {
            residuals[j - start] = points.get(j).getResidual();
        }
        return residuals;
    }

    public static double mean(double[] values) {
        double sum = 0;
        for (double v : values) sum += v;
        return sum / values.length;
    }

    /**
     * 总体标准差
     */
    public static double std(double[] values) {
        double mean = mean(values);
        double sumSquares = 0;
        for (double v : values) {
            double diff = v - mean;
            sumSquares += diff * diff;
        }
        return Math.sqrt(sumSquares / values.length);
    }

    /**
     * 线性插值分位数，p 取值 [0,1]
     */
    public static double quantile(double[] values, double p) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        if (sorted.length == 1) {
            return sorted[0];
        }
        double pos = p * (sorted.length - 1);
        int lower = (int) Math.floor(pos);
        int upper = (int) Math.ceil(pos);
        double frac = pos - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * frac;
    }
}
