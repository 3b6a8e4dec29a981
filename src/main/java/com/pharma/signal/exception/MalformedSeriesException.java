package com.pharma.signal.exception;

/**
 * Raised when raw observations cannot form a valid quarterly series: misaligned
 * or duplicate periods, negative counts, or too few periods after normalization.
 */
public class MalformedSeriesException extends MonitoringException {

    public MalformedSeriesException(String message) {
        super(message);
    }

    @Override
    public String getErrorCode() {
        return "MALFORMED_SERIES";
    }
}
