package com.weatherbites.service;

import com.weatherbites.dto.recommendation.BandRecommendations;
import com.weatherbites.dto.recommendation.CurrentWeather;
import com.weatherbites.dto.recommendation.LocationRecommendation;
import com.weatherbites.dto.recommendation.SeasonalRecommendation;
import com.weatherbites.dto.recommendation.SnackPairing;
import com.weatherbites.dto.recommendation.SnackRecommendation;
import com.weatherbites.exception.InvalidInputException;
import com.weatherbites.exception.WeatherUnavailableException;
import com.weatherbites.model.TemperatureBand;
import com.weatherbites.service.external.WeatherLookup;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Random;

/**
 * Combines the current temperature of a city with the band tables.
 * One weather lookup per call; nothing is cached.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecommendationService {

    private final WeatherLookup weatherLookup;
    private final TemperatureBucketingService bucketingService;
    private final Random random;

    public LocationRecommendation getLocations(String city) {
        double temperature = fetchTemperature(city);
        return LocationRecommendation.builder()
            .temperature(temperature)
            .locations(bucketingService.classify(temperature).getLocations())
            .build();
    }

    public SnackRecommendation getSnacks(String city) {
        double temperature = fetchTemperature(city);
        return SnackRecommendation.builder()
            .temperature(temperature)
            .snacks(bucketingService.classify(temperature).getSnacks())
            .build();
    }

    public SeasonalRecommendation getSeasonalSnacks(String city) {
        double temperature = fetchTemperature(city);
        return SeasonalRecommendation.builder()
            .temperature(temperature)
            .seasonalSnacks(bucketingService.classify(temperature).getSeasonalSnacks())
            .build();
    }

    public SnackPairing getPairing(String city) {
        double temperature = fetchTemperature(city);
        BandRecommendations band = bucketingService.classify(temperature);

        List<String> snacks = band.getSnacks();
        String snack = snacks.get(random.nextInt(snacks.size()));
        String drink = band.getSeasonalSnacks().get(0);

        log.info("Paired {} with {} for {} ({}F)", snack, drink, city, temperature);
        return SnackPairing.builder()
            .temperature(temperature)
            .snack(snack)
            .drink(drink)
            .build();
    }

    public CurrentWeather getCurrentWeather(String city) {
        double temperature = fetchTemperature(city);
        TemperatureBand band = bucketingService.bandFor(temperature);
        return CurrentWeather.builder()
            .city(city)
            .temperature(temperature)
            .band(band)
            .build();
    }

    private double fetchTemperature(String city) {
        if (city == null || city.isBlank()) {
            throw new InvalidInputException("City is required");
        }
        return weatherLookup.currentTemperature(city)
            .orElseThrow(() -> {
                log.warn("No weather reading for city: {}", city);
                return new WeatherUnavailableException(city);
            });
    }
}
