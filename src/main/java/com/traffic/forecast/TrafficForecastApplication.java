package com.traffic.forecast;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TrafficForecastApplication {

    private static final Logger log = LoggerFactory.getLogger(TrafficForecastApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(TrafficForecastApplication.class, args);
        log.info("Traffic forecast engine started, waiting for historical data");
    }
}
