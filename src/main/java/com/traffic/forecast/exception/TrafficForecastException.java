package com.traffic.forecast.exception;

/**
 * Base type for every failure raised by the forecasting engine.
 */
public class TrafficForecastException extends RuntimeException {

    public TrafficForecastException(String message) {
        super(message);
    }

    public TrafficForecastException(String message, Throwable cause) {
        super(message, cause);
    }
}
