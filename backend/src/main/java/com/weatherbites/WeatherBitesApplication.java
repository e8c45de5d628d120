package com.weatherbites;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

@SpringBootApplication
@Slf4j
public class WeatherBitesApplication {
    public static void main(String[] args) {
        SpringApplication.run(WeatherBitesApplication.class, args);
    }

    @PreDestroy
    public void onExit() {
        log.info("Application is shutting down. Closing resources...");
    }
}
