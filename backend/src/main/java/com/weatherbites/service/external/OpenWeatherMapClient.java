package com.weatherbites.service.external;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.OptionalDouble;

/**
 * OpenWeatherMap Current Weather API Integration
 *
 * Requests {@code units=imperial} so readings line up with the Fahrenheit band thresholds.
 *
 * API Documentation: https://openweathermap.org/current
 */
@Service
@Slf4j
public class OpenWeatherMapClient implements WeatherLookup {

    private final WebClient webClient;
    private final String apiKey;
    private final Duration timeout;

    @Autowired
    public OpenWeatherMapClient(
            WebClient.Builder webClientBuilder,
            @Value("${openweathermap.api-url}") String apiUrl,
            @Value("${openweathermap.api-key}") String apiKey,
            @Value("${openweathermap.timeout:5s}") Duration timeout) {

        this.apiKey = apiKey;
        this.timeout = timeout;

        this.webClient = webClientBuilder.clone()
            .baseUrl(apiUrl)
            .build();
    }

    /**
     * Fetch the current temperature for a city
     */
    @Override
    public OptionalDouble currentTemperature(String city) {
        log.info("Fetching current weather for city: {}", city);

        try {
            JsonNode response = webClient.get()
                .uri(uriBuilder -> uriBuilder
                    .path("/weather")
                    .queryParam("q", city)
                    .queryParam("appid", apiKey)
                    .queryParam("units", "imperial")
                    .build())
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(timeout)
                .block();

            return parseTemperature(response, city);

        } catch (WebClientResponseException e) {
            log.warn("Weather API returned {} for city {}", e.getStatusCode().value(), city);
            return OptionalDouble.empty();
        } catch (Exception e) {
            log.error("Failed to fetch weather for city {}: {}", city, e.getMessage());
            return OptionalDouble.empty();
        }
    }

    private OptionalDouble parseTemperature(JsonNode response, String city) {
        if (response == null) {
            log.warn("Empty weather response for city: {}", city);
            return OptionalDouble.empty();
        }
        JsonNode temp = response.path("main").path("temp");
        if (!temp.isNumber()) {
            log.warn("Weather response for city {} has no main.temp field", city);
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(temp.asDouble());
    }
}
