package com.weatherbites.controller;

import com.weatherbites.service.ReviewService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

// ========== Admin Controller ==========
@RestController
@RequestMapping("/api/admin")
@RequiredArgsConstructor
@Tag(name = "Admin", description = "Administrative reset operations")
public class AdminController {

    private final ReviewService reviewService;

    @DeleteMapping("/reviews")
    @Operation(summary = "Remove every review (test/reset only)")
    public ResponseEntity<Void> clearReviews() {
        reviewService.clearReviews();
        return ResponseEntity.noContent().build();
    }
}
