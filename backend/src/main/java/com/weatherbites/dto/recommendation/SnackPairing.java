package com.weatherbites.dto.recommendation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

// ========== Snack Pairing DTO ==========
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SnackPairing {
    private Double temperature;
    private String snack; // random pick from the band's snacks
    private String drink; // the band's seasonal item
}
