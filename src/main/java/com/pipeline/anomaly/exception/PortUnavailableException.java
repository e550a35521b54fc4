package com.pipeline.anomaly.exception;

/**
 * 端口不可达或调用出错
 */
public class PortUnavailableException extends PortException {

    public PortUnavailableException(String port, String operation, Throwable cause) {
        super(port, operation, "Call to " + port + "." + operation + " failed: "
                + (cause != null ? cause.getMessage() : "unknown error"), cause);
    }
}
