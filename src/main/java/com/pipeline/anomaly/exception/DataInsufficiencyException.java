package com.pipeline.anomaly.exception;

/**
 * 上下文数据不足以推断采样频率，仅影响当前周期
 */
public class DataInsufficiencyException extends PipelineException {

    public DataInsufficiencyException(String message) {
        super(message);
    }
}
