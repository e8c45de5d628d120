package com.weatherbites.dto.recommendation;

import com.weatherbites.model.TemperatureBand;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

// ========== Current Weather DTO ==========
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CurrentWeather {
    private String city;
    private Double temperature;
    private TemperatureBand band;
}
