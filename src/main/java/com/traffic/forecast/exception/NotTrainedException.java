package com.traffic.forecast.exception;

public class NotTrainedException extends TrafficForecastException {

    public NotTrainedException(String message) {
        super(message);
    }
}
