package com.weatherbites.controller;

import com.weatherbites.dto.review.*;
import com.weatherbites.model.Review;
import com.weatherbites.service.ReviewService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import jakarta.validation.Valid;
import java.util.List;

// ========== Review Controller ==========
@RestController
@RequestMapping("/api/reviews")
@RequiredArgsConstructor
@Tag(name = "Reviews", description = "Snack review management")
public class ReviewController {

    private final ReviewService reviewService;

    @PostMapping
    @Operation(summary = "Create review")
    public ResponseEntity<Review> createReview(@Valid @RequestBody CreateReviewRequest request) {
        Review created = reviewService.createReview(
            request.getName(),
            request.getLocation(),
            request.getRating(),
            request.getFavorite(),
            request.getReview()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get review by ID")
    public ResponseEntity<Review> getReviewById(@PathVariable String id) {
        return ResponseEntity.ok(reviewService.getReviewById(id));
    }

    @GetMapping("/by-name")
    @Operation(summary = "Get review by snack name")
    public ResponseEntity<Review> getReviewByName(@RequestParam String name) {
        return ResponseEntity.ok(reviewService.getReviewByName(name));
    }

    @GetMapping("/favorites")
    @Operation(summary = "List favorite reviews")
    public ResponseEntity<List<Review>> getFavorites() {
        return ResponseEntity.ok(reviewService.getFavorites());
    }

    @PatchMapping("/{id}/review")
    @Operation(summary = "Update review text")
    public ResponseEntity<Review> updateReviewText(
            @PathVariable String id,
            @RequestBody UpdateReviewTextRequest request) {
        return ResponseEntity.ok(reviewService.updateReviewText(id, request.getReview()));
    }

    @PatchMapping("/{id}/rating")
    @Operation(summary = "Update rating")
    public ResponseEntity<Review> updateRating(
            @PathVariable String id,
            @Valid @RequestBody UpdateRatingRequest request) {
        return ResponseEntity.ok(reviewService.updateRating(id, request.getRating()));
    }

    @PatchMapping("/{id}/favorite")
    @Operation(summary = "Add to or remove from favorites")
    public ResponseEntity<Review> updateFavorite(
            @PathVariable String id,
            @Valid @RequestBody UpdateFavoriteRequest request) {
        return ResponseEntity.ok(reviewService.updateFavorite(id, request.getFavorite()));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Soft-delete review")
    public ResponseEntity<Void> deleteReview(@PathVariable String id) {
        reviewService.deleteReview(id);
        return ResponseEntity.noContent().build();
    }
}
