package com.weatherbites.repository;

import com.weatherbites.exception.ReviewConflictException;
import com.weatherbites.exception.StorageException;
import com.weatherbites.model.Review;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * MongoDB-backed {@link ReviewStore}.
 * <p>
 * Name uniqueness comes from the unique index on {@code reviews.name}. Mutations are single
 * {@code findAndModify} calls guarded by {@code deleted = false}, so a concurrent soft delete
 * can never be overwritten.
 */
@Component
@ConditionalOnProperty(name = "weatherbites.store.type", havingValue = "mongo", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class MongoReviewStore implements ReviewStore {

    static final Sort CREATION_ORDER = Sort.by(Sort.Order.asc("createdAt"), Sort.Order.asc("id"));

    private final ReviewRepository reviewRepository;
    private final MongoTemplate mongoTemplate;

    @Override
    public Review insert(Review draft) {
        try {
            return reviewRepository.insert(draft);
        } catch (DuplicateKeyException e) {
            log.error("Duplicate snack name: {}", draft.getName());
            throw new ReviewConflictException(draft.getName(), e);
        } catch (DataAccessException e) {
            throw storageFailure("inserting review " + draft.getName(), e);
        }
    }

    @Override
    public Optional<Review> findById(String id) {
        try {
            return reviewRepository.findById(id);
        } catch (DataAccessException e) {
            throw storageFailure("loading review " + id, e);
        }
    }

    @Override
    public Optional<Review> findByName(String name) {
        try {
            return reviewRepository.findByName(name);
        } catch (DataAccessException e) {
            throw storageFailure("loading review named " + name, e);
        }
    }

    @Override
    public Optional<Review> updateIfLive(String id, ReviewPatch patch) {
        Update update = new Update()
            .set(patch.propertyName(), patch.value())
            .set("updatedAt", LocalDateTime.now());
        try {
            Review updated = mongoTemplate.findAndModify(
                liveById(id),
                update,
                FindAndModifyOptions.options().returnNew(true),
                Review.class
            );
            return Optional.ofNullable(updated);
        } catch (DataAccessException e) {
            throw storageFailure("updating " + patch.propertyName() + " of review " + id, e);
        }
    }

    @Override
    public boolean markDeleted(String id) {
        Update update = new Update()
            .set("deleted", true)
            .set("updatedAt", LocalDateTime.now());
        try {
            return mongoTemplate.findAndModify(liveById(id), update, Review.class) != null;
        } catch (DataAccessException e) {
            throw storageFailure("deleting review " + id, e);
        }
    }

    @Override
    public List<Review> findLiveFavorites() {
        try {
            return reviewRepository.findLiveFavorites(CREATION_ORDER);
        } catch (DataAccessException e) {
            throw storageFailure("listing favorite reviews", e);
        }
    }

    @Override
    public void deleteAll() {
        try {
            reviewRepository.deleteAll();
        } catch (DataAccessException e) {
            throw storageFailure("clearing reviews", e);
        }
    }

    private static Query liveById(String id) {
        return Query.query(Criteria.where("id").is(id).and("deleted").is(false));
    }

    private static StorageException storageFailure(String action, DataAccessException e) {
        log.error("Database error while {}: {}", action, e.getMessage());
        return new StorageException("Database error while " + action, e);
    }
}
