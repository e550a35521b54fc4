package com.pipeline.anomaly.exception;

/**
 * 模型返回的预测结果形状不合法：点数不足，或时间戳间隔与管道步长不一致
 */
public class InvalidForecastException extends PipelineException {

    public InvalidForecastException(String message) {
        super(message);
    }
}
