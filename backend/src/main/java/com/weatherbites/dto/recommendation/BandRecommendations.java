package com.weatherbites.dto.recommendation;

import com.weatherbites.model.TemperatureBand;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

// ========== Band Recommendations DTO ==========
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BandRecommendations {
    private TemperatureBand band;
    private String label; // e.g. "31-45"
    private List<String> locations;
    private List<String> snacks;
    private List<String> seasonalSnacks;
}
