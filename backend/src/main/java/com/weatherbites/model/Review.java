package com.weatherbites.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDateTime;

// ========== Review Entity ==========
@Document(collection = "reviews")
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@CompoundIndex(name = "favorite_live_idx", def = "{'favorite': 1, 'deleted': 1, 'createdAt': 1}")
public class Review {
    @Id
    private String id;

    @Indexed(unique = true)
    private String name; // what was purchased

    private String location; // one of TemperatureBand.allLocations()

    private Integer rating; // 1-5

    private Boolean favorite;

    private String review;

    @Builder.Default
    private boolean deleted = false;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
