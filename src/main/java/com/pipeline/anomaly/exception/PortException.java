package com.pipeline.anomaly.exception;

/**
 * 外部端口（时序存储、预测模型、调度器、配置存储）调用失败
 */
public abstract class PortException extends PipelineException {

    private final String port;
    private final String operation;

    protected PortException(String port, String operation, String message, Throwable cause) {
        super(message, cause);
        this.port = port;
        this.operation = operation;
    }

    public String getPort() {
        return port;
    }

    public String getOperation() {
        return operation;
    }
}
