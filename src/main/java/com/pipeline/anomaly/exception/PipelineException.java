package com.pipeline.anomaly.exception;

/**
 * 管道执行周期中所有错误的基类。
 * 任一子类抛出即表示本周期失败，由外部任务执行层决定是否重试，引擎内部不做重试。
 */
public class PipelineException extends RuntimeException {

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
