package com.weatherbites.repository;

import com.weatherbites.exception.ReviewConflictException;
import com.weatherbites.model.Review;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link ReviewStore} kept in process memory. Insertion order of the backing map is creation
 * order. All access is serialized on the store monitor; callers only ever see copies.
 */
@Component
@ConditionalOnProperty(name = "weatherbites.store.type", havingValue = "memory")
@Slf4j
public class InMemoryReviewStore implements ReviewStore {

    private final Map<String, Review> reviewsById = new LinkedHashMap<>();
    private final Map<String, String> idsByName = new LinkedHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public synchronized Review insert(Review draft) {
        if (idsByName.containsKey(draft.getName())) {
            log.error("Duplicate snack name: {}", draft.getName());
            throw new ReviewConflictException(draft.getName());
        }
        Review stored = draft.toBuilder()
            .id(String.valueOf(sequence.incrementAndGet()))
            .build();
        reviewsById.put(stored.getId(), stored);
        idsByName.put(stored.getName(), stored.getId());
        return copy(stored);
    }

    @Override
    public synchronized Optional<Review> findById(String id) {
        return Optional.ofNullable(reviewsById.get(id)).map(InMemoryReviewStore::copy);
    }

    @Override
    public synchronized Optional<Review> findByName(String name) {
        String id = idsByName.get(name);
        return id == null ? Optional.empty() : findById(id);
    }

    @Override
    public synchronized Optional<Review> updateIfLive(String id, ReviewPatch patch) {
        Review existing = reviewsById.get(id);
        if (existing == null || existing.isDeleted()) {
            return Optional.empty();
        }
        patch.applyTo(existing);
        existing.setUpdatedAt(LocalDateTime.now());
        return Optional.of(copy(existing));
    }

    @Override
    public synchronized boolean markDeleted(String id) {
        Review existing = reviewsById.get(id);
        if (existing == null || existing.isDeleted()) {
            return false;
        }
        existing.setDeleted(true);
        existing.setUpdatedAt(LocalDateTime.now());
        return true;
    }

    @Override
    public synchronized List<Review> findLiveFavorites() {
        List<Review> favorites = new ArrayList<>();
        for (Review review : reviewsById.values()) {
            if (!review.isDeleted() && Boolean.TRUE.equals(review.getFavorite())) {
                favorites.add(copy(review));
            }
        }
        return favorites;
    }

    @Override
    public synchronized void deleteAll() {
        reviewsById.clear();
        idsByName.clear();
    }

    private static Review copy(Review review) {
        return review.toBuilder().build();
    }
}
