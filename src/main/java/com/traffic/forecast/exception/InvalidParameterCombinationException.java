package com.traffic.forecast.exception;

/**
 * A model-order candidate that cannot be evaluated on the given series, e.g. too few
 * points left after differencing. Always recoverable: the candidate is just dropped.
 */
public class InvalidParameterCombinationException extends TrafficForecastException {

    public InvalidParameterCombinationException(String message) {
        super(message);
    }
}
