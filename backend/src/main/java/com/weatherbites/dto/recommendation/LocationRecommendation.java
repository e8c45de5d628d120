package com.weatherbites.dto.recommendation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

// ========== Location Recommendation DTO ==========
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LocationRecommendation {
    private Double temperature; // Fahrenheit
    private List<String> locations;
}
