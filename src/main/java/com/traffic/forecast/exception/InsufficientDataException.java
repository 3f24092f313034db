package com.traffic.forecast.exception;

/**
 * Raised when an operation receives fewer samples than it needs. Not retryable:
 * the caller has to supply more history.
 */
public class InsufficientDataException extends TrafficForecastException {

    private final int required;
    private final int actual;

    public InsufficientDataException(String message, int required, int actual) {
        super(message + " (required " + required + ", got " + actual + ")");
        this.required = required;
        this.actual = actual;
    }

    public int getRequired() { return required; }

    public int getActual() { return actual; }
}
