package com.pipeline.anomaly.core;

import com.pipeline.anomaly.model.AnomalyConfig;
import com.pipeline.anomaly.model.AnomalyScore;
import com.pipeline.anomaly.model.ForecastRequest;
import com.pipeline.anomaly.model.ForecastResult;
import com.pipeline.anomaly.model.TimeSeriesRow;

import java.util.List;
import java.util.Map;

/**
 * 预测模型端口。本地基础模型和远程HTTP模型服务都通过该接口接入。
 */
public interface ForecastingModel {

    /**
     * 预测。
     *
     * @param rows    上下文数据，可能包含多条序列（多变量或协变量）
     * @param request 预测长度、分位数和模型参数
     * @return 每个未来时间点的均值和各分位数；无结果返回空结果
     */
    ForecastResult predict(List<TimeSeriesRow> rows, ForecastRequest request);

    /**
     * 训练。
     *
     * @return 新模型的标识或产物引用
     */
    String train(List<TimeSeriesRow> rows, Map<String, Object> parameters);

    boolean healthCheck();

    /**
     * 模型是否自带异常检测能力（如孤立森林）
     */
    default boolean supportsAnomalyDetection() {
        return false;
    }

    /**
     * 由模型直接给出异常评分，每个实际值对应一个评分。
     * 仅当 {@link #supportsAnomalyDetection()} 为true时调用。
     */
    default List<AnomalyScore> detectAnomalies(List<TimeSeriesRow> actuals,
                                               ForecastResult forecast,
                                               AnomalyConfig config) {
        throw new UnsupportedOperationException("Model does not support anomaly detection");
    }
}
