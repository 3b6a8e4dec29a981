package com.pharma.signal.exception;

import lombok.Getter;

/**
 * Raised by the forecast stage when the series holds fewer observed points than
 * the configured minimum.
 */
@Getter
public class InsufficientDataException extends MonitoringException {

    private final int availablePoints;
    private final int requiredPoints;

    public InsufficientDataException(int availablePoints, int requiredPoints) {
        super(String.format("Forecasting requires at least %d observed periods, got %d",
                requiredPoints, availablePoints));
        this.availablePoints = availablePoints;
        this.requiredPoints = requiredPoints;
    }

    @Override
    public String getErrorCode() {
        return "INSUFFICIENT_DATA";
    }
}
