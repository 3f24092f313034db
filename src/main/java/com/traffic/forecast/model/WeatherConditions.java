package com.traffic.forecast.model;

/**
 * Weather attached to an observation. Rainfall in mm/h, visibility in km,
 * temperature in degrees Celsius.
 */
public class WeatherConditions {
    private final double temperature;
    private final double humidity;
    private final double rainfall;
    private final double visibility;
    private final double windSpeed;

    public WeatherConditions(double temperature, double humidity, double rainfall,
                             double visibility, double windSpeed) {
        this.temperature = temperature;
        this.humidity = humidity;
        this.rainfall = rainfall;
        this.visibility = visibility;
        this.windSpeed = windSpeed;
    }

    public static WeatherConditions clear() {
        return new WeatherConditions(25, 50, 0, 10, 5);
    }

    public double getTemperature() { return temperature; }
    public double getHumidity() { return humidity; }
    public double getRainfall() { return rainfall; }
    public double getVisibility() { return visibility; }
    public double getWindSpeed() { return windSpeed; }
}
