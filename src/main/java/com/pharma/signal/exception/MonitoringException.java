package com.pharma.signal.exception;

/**
 * Base type for unrecoverable pipeline failures. Subclasses carry a stable
 * error code that the REST layer exposes alongside the message.
 */
public abstract class MonitoringException extends RuntimeException {

    protected MonitoringException(String message) {
        super(message);
    }

    public abstract String getErrorCode();
}
