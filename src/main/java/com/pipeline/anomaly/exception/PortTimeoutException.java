package com.pipeline.anomaly.exception;

/**
 * 端口调用超时
 */
public class PortTimeoutException extends PortException {

    private final long timeoutMs;

    public PortTimeoutException(String port, String operation, long timeoutMs) {
        super(port, operation, "Call to " + port + "." + operation + " timed out after " + timeoutMs + "ms", null);
        this.timeoutMs = timeoutMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
