package com.weatherbites.repository;

import com.weatherbites.model.Review;

import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for {@link Review} records.
 *
 * <p>{@code ReviewService} depends on this interface rather than on Spring Data directly so the
 * backend can be MongoDB in normal operation or an in-memory map for local runs. Every method
 * is atomic for the record it touches.
 */
public interface ReviewStore {

    /**
     * Inserts a new record and assigns its id.
     *
     * @param draft validated record without an id
     * @return the stored record
     * @throws com.weatherbites.exception.ReviewConflictException if the name is already taken
     */
    Review insert(Review draft);

    /**
     * @param id identifier to look up
     * @return the record in any state, including soft-deleted
     */
    Optional<Review> findById(String id);

    /**
     * @param name unique name to look up
     * @return the record in any state, including soft-deleted
     */
    Optional<Review> findByName(String name);

    /**
     * Applies the patch only if the record exists and is not soft-deleted.
     *
     * @return the updated record, or empty if there is no live record with this id
     */
    Optional<Review> updateIfLive(String id, ReviewPatch patch);

    /**
     * Flips {@code deleted} to true if it is currently false.
     *
     * @return {@code true} if this call performed the transition
     */
    boolean markDeleted(String id);

    /**
     * @return live records flagged as favorite, in creation order
     */
    List<Review> findLiveFavorites();

    /**
     * Physically removes every record. Administrative reset only.
     */
    void deleteAll();
}
