package com.pipeline.anomaly.exception;

/**
 * 时长字符串无法解析
 */
public class InvalidDurationException extends ConfigurationException {

    private final String value;

    public InvalidDurationException(String value, String reason) {
        super("Invalid duration '" + value + "': " + reason);
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
