package com.weatherbites.controller;

import com.weatherbites.dto.recommendation.*;
import com.weatherbites.service.*;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

// ========== Recommendation Controller ==========
@RestController
@RequestMapping("/api/recommendations")
@RequiredArgsConstructor
@Tag(name = "Recommendations", description = "Weather-based snack recommendations")
public class RecommendationController {

    private final RecommendationService recommendationService;
    private final TemperatureBucketingService bucketingService;

    @GetMapping("/locations")
    @Operation(summary = "Recommend snack locations for the current weather in a city")
    public ResponseEntity<LocationRecommendation> getLocations(@RequestParam(required = false) String city) {
        return ResponseEntity.ok(recommendationService.getLocations(city));
    }

    @GetMapping("/snacks")
    @Operation(summary = "Recommend snacks for the current weather in a city")
    public ResponseEntity<SnackRecommendation> getSnacks(@RequestParam(required = false) String city) {
        return ResponseEntity.ok(recommendationService.getSnacks(city));
    }

    @GetMapping("/seasonal")
    @Operation(summary = "Recommend the seasonal snack for the current weather in a city")
    public ResponseEntity<SeasonalRecommendation> getSeasonalSnacks(@RequestParam(required = false) String city) {
        return ResponseEntity.ok(recommendationService.getSeasonalSnacks(city));
    }

    @GetMapping("/pairing")
    @Operation(summary = "Pair a random snack with the seasonal drink")
    public ResponseEntity<SnackPairing> getPairing(@RequestParam(required = false) String city) {
        return ResponseEntity.ok(recommendationService.getPairing(city));
    }

    @GetMapping("/weather")
    @Operation(summary = "Current temperature and band for a city")
    public ResponseEntity<CurrentWeather> getCurrentWeather(@RequestParam(required = false) String city) {
        return ResponseEntity.ok(recommendationService.getCurrentWeather(city));
    }

    @GetMapping("/bands/classify")
    @Operation(summary = "Classify a Fahrenheit temperature without a weather lookup")
    public ResponseEntity<BandRecommendations> classify(@RequestParam double temperature) {
        return ResponseEntity.ok(bucketingService.classify(temperature));
    }
}
