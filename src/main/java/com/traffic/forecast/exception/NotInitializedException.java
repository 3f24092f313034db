package com.traffic.forecast.exception;

public class NotInitializedException extends TrafficForecastException {

    public NotInitializedException(String message) {
        super(message);
    }
}
