package com.weatherbites.service;

import com.weatherbites.exception.InvalidInputException;
import com.weatherbites.exception.ReviewAlreadyDeletedException;
import com.weatherbites.exception.ReviewNotFoundException;
import com.weatherbites.model.Review;
import com.weatherbites.repository.ReviewPatch;
import com.weatherbites.repository.ReviewStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;

// ========== Review Service ==========
@Service
@RequiredArgsConstructor
@Slf4j
public class ReviewService {

    static final int MIN_RATING = 1;
    static final int MAX_RATING = 5;

    private final ReviewStore reviewStore;
    private final TemperatureBucketingService bucketingService;

    public Review createReview(String name, String location, Integer rating, Boolean favorite, String reviewText) {
        if (name == null || name.isBlank()) {
            throw new InvalidInputException("Name is required");
        }
        validateRating(rating);
        if (location == null || !bucketingService.allowedLocations().contains(location)) {
            throw new InvalidInputException("Invalid location: " + location
                + ". Must be a restaurant from the following: "
                + String.join(", ", bucketingService.allowedLocations()));
        }
        if (favorite == null) {
            throw new InvalidInputException(
                "Review must be either added to favorites (true) or not added (false)");
        }

        LocalDateTime now = LocalDateTime.now();
        Review saved = reviewStore.insert(Review.builder()
            .name(name)
            .location(location)
            .rating(rating)
            .favorite(favorite)
            .review(reviewText)
            .deleted(false)
            .createdAt(now)
            .updatedAt(now)
            .build());

        log.info("Review successfully added: {} (ID: {})", saved.getName(), saved.getId());
        return saved;
    }

    public Review getReviewById(String id) {
        Review review = reviewStore.findById(id)
            .orElseThrow(() -> {
                log.info("Review with ID {} not found", id);
                return ReviewNotFoundException.forId(id);
            });
        if (review.isDeleted()) {
            log.info("Review with ID {} has been deleted", id);
            throw ReviewNotFoundException.forId(id);
        }
        return review;
    }

    public Review getReviewByName(String name) {
        Review review = reviewStore.findByName(name)
            .orElseThrow(() -> {
                log.info("Review with name {} not found", name);
                return ReviewNotFoundException.forName(name);
            });
        if (review.isDeleted()) {
            log.info("Review with name {} has been deleted", name);
            throw ReviewNotFoundException.forName(name);
        }
        return review;
    }

    public void deleteReview(String id) {
        Review review = reviewStore.findById(id)
            .orElseThrow(() -> {
                log.info("Review with ID {} not found", id);
                return ReviewNotFoundException.forId(id);
            });
        if (review.isDeleted() || !reviewStore.markDeleted(id)) {
            log.info("Review with ID {} has already been deleted", id);
            throw new ReviewAlreadyDeletedException(id);
        }
        log.info("Review with ID {} marked as deleted", id);
    }

    public Review updateReviewText(String id, String reviewText) {
        Review updated = applyToLive(id, ReviewPatch.reviewText(reviewText));
        log.info("Updated review text for ID {}", id);
        return updated;
    }

    public Review updateRating(String id, Integer rating) {
        validateRating(rating);
        Review updated = applyToLive(id, ReviewPatch.rating(rating));
        log.info("Updated rating for ID {} to {}", id, rating);
        return updated;
    }

    public Review updateFavorite(String id, Boolean favorite) {
        if (favorite == null) {
            throw new InvalidInputException("Favorite status must be a boolean value (true or false)");
        }
        Review updated = applyToLive(id, ReviewPatch.favorite(favorite));
        log.info("Updated favorite status for ID {} to {}", id, favorite);
        return updated;
    }

    public List<Review> getFavorites() {
        List<Review> favorites = reviewStore.findLiveFavorites();
        log.info("Retrieved {} favorite reviews", favorites.size());
        return favorites;
    }

    /**
     * Removes every review, deleted or not. Administrative reset; not part of the record
     * lifecycle.
     */
    public void clearReviews() {
        reviewStore.deleteAll();
        log.warn("All reviews cleared");
    }

    private Review applyToLive(String id, ReviewPatch patch) {
        return reviewStore.updateIfLive(id, patch)
            .orElseThrow(() -> {
                log.info("Review with ID {} not found", id);
                return ReviewNotFoundException.forId(id);
            });
    }

    private static void validateRating(Integer rating) {
        if (rating == null || rating < MIN_RATING || rating > MAX_RATING) {
            throw new InvalidInputException("Invalid rating: " + rating + ". Rating must be an integer from 1-5");
        }
    }
}
