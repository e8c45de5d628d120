package com.weatherbites.repository;

import com.weatherbites.model.Review;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Single-attribute change to a live review. Exactly one of the attributes is set.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ReviewPatch {

    public enum Field { REVIEW, RATING, FAVORITE }

    private final Field field;
    private final String review;
    private final Integer rating;
    private final Boolean favorite;

    public static ReviewPatch reviewText(String review) {
        return new ReviewPatch(Field.REVIEW, review, null, null);
    }

    public static ReviewPatch rating(int rating) {
        return new ReviewPatch(Field.RATING, null, rating, null);
    }

    public static ReviewPatch favorite(boolean favorite) {
        return new ReviewPatch(Field.FAVORITE, null, null, favorite);
    }

    /** Name of the document property this patch writes. */
    public String propertyName() {
        switch (field) {
            case REVIEW:
                return "review";
            case RATING:
                return "rating";
            default:
                return "favorite";
        }
    }

    public Object value() {
        switch (field) {
            case REVIEW:
                return review;
            case RATING:
                return rating;
            default:
                return favorite;
        }
    }

    public void applyTo(Review target) {
        switch (field) {
            case REVIEW:
                target.setReview(review);
                break;
            case RATING:
                target.setRating(rating);
                break;
            default:
                target.setFavorite(favorite);
        }
    }
}
