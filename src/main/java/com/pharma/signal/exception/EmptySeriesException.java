package com.pharma.signal.exception;

public class EmptySeriesException extends MonitoringException {

    public EmptySeriesException(String drug) {
        super("Cannot summarize an empty series for " + drug);
    }

    @Override
    public String getErrorCode() {
        return "EMPTY_SERIES";
    }
}
