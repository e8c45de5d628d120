package com.weatherbites.service;

import com.weatherbites.dto.recommendation.BandRecommendations;
import com.weatherbites.exception.InvalidInputException;
import com.weatherbites.model.TemperatureBand;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;

/**
 * Classifies a Fahrenheit reading into one of the six {@link TemperatureBand}s.
 * Stateless; safe to share across threads.
 */
@Service
public class TemperatureBucketingService {

    public TemperatureBand bandFor(double fahrenheit) {
        if (Double.isNaN(fahrenheit)) {
            throw new InvalidInputException("Temperature must be a number");
        }
        return TemperatureBand.of(fahrenheit);
    }

    public BandRecommendations classify(double fahrenheit) {
        TemperatureBand band = bandFor(fahrenheit);
        return BandRecommendations.builder()
            .band(band)
            .label(band.getLabel())
            .locations(band.getLocations())
            .snacks(band.getSnacks())
            .seasonalSnacks(List.of(band.getSeasonalSnack()))
            .build();
    }

    public Set<String> allowedLocations() {
        return TemperatureBand.allLocations();
    }
}
