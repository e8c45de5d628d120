package com.weatherbites.repository;

import com.weatherbites.model.Review;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

// ========== Review Repository ==========
@Repository
public interface ReviewRepository extends MongoRepository<Review, String> {

    Optional<Review> findByName(String name);

    @Query("{ 'favorite': true, 'deleted': false }")
    List<Review> findLiveFavorites(Sort sort);
}
