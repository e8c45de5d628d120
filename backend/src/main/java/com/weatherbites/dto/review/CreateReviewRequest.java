package com.weatherbites.dto.review;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateReviewRequest {
    @NotBlank
    private String name;

    @NotBlank
    private String location;

    @NotNull
    @Min(1)
    @Max(5)
    private Integer rating;

    @NotNull
    private Boolean favorite;

    private String review;
}
