package com.weatherbites.dto.recommendation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

// ========== Snack Recommendation DTO ==========
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SnackRecommendation {
    private Double temperature;
    private List<String> snacks;
}
