package com.pipeline.anomaly.exception;

import java.util.Collections;
import java.util.List;

/**
 * 配置错误：时长、cron表达式不合法或缺少必填项。在任何I/O之前中止周期。
 */
public class ConfigurationException extends PipelineException {

    private final List<String> errors;

    public ConfigurationException(String message) {
        this(message, Collections.singletonList(message));
    }

    public ConfigurationException(String message, List<String> errors) {
        super(message);
        this.errors = Collections.unmodifiableList(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
