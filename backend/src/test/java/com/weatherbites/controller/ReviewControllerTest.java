package com.weatherbites.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.weatherbites.config.SecurityConfig;
import com.weatherbites.dto.review.CreateReviewRequest;
import com.weatherbites.exception.InvalidInputException;
import com.weatherbites.exception.ReviewAlreadyDeletedException;
import com.weatherbites.exception.ReviewConflictException;
import com.weatherbites.exception.ReviewNotFoundException;
import com.weatherbites.exception.StorageException;
import com.weatherbites.model.Review;
import com.weatherbites.service.ReviewService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ReviewController.class)
@Import(SecurityConfig.class)
class ReviewControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private ReviewService reviewService;

    private static Review hotChocolate() {
        return Review.builder()
            .id("r1")
            .name("Hot Chocolate")
            .location("1369 Coffee House")
            .rating(5)
            .favorite(true)
            .review("great")
            .build();
    }

    @Test
    void createReview_returnsCreatedRecord() throws Exception {
        when(reviewService.createReview("Hot Chocolate", "1369 Coffee House", 5, true, "great"))
            .thenReturn(hotChocolate());

        CreateReviewRequest request = CreateReviewRequest.builder()
            .name("Hot Chocolate")
            .location("1369 Coffee House")
            .rating(5)
            .favorite(true)
            .review("great")
            .build();

        mockMvc.perform(post("/api/reviews")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.id").value("r1"))
            .andExpect(jsonPath("$.rating").value(5))
            .andExpect(jsonPath("$.favorite").value(true));
    }

    @Test
    void createReview_rejectsOutOfRangeRatingBeforeService() throws Exception {
        String body = "{\"name\":\"Cookie\",\"location\":\"Levain\",\"rating\":6,\"favorite\":false}";

        mockMvc.perform(post("/api/reviews").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("INVALID_INPUT"));

        verifyNoInteractions(reviewService);
    }

    @Test
    void createReview_rejectsNonBooleanFavorite() throws Exception {
        String body = "{\"name\":\"Cookie\",\"location\":\"Levain\",\"rating\":4,\"favorite\":\"maybe\"}";

        mockMvc.perform(post("/api/reviews").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("INVALID_INPUT"));

        verifyNoInteractions(reviewService);
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "{\"name\":\"Cookie\",\"location\":\"Levain\",\"rating\":4.8,\"favorite\":true}",
        "{\"name\":\"Cookie\",\"location\":\"Levain\",\"rating\":\"4\",\"favorite\":true}",
        "{\"name\":\"Cookie\",\"location\":\"Levain\",\"rating\":4,\"favorite\":\"true\"}",
        "{\"name\":\"Cookie\",\"location\":\"Levain\",\"rating\":4,\"favorite\":1}"
    })
    void createReview_rejectsCoercedScalars(String body) throws Exception {
        mockMvc.perform(post("/api/reviews").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("INVALID_INPUT"));

        verifyNoInteractions(reviewService);
    }

    @ParameterizedTest
    @ValueSource(strings = {"{\"rating\":5.9}", "{\"rating\":\"3\"}"})
    void updateRating_rejectsNonIntegerRating(String body) throws Exception {
        mockMvc.perform(patch("/api/reviews/r1/rating").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("INVALID_INPUT"));

        verifyNoInteractions(reviewService);
    }

    @ParameterizedTest
    @ValueSource(strings = {"{\"favorite\":1}", "{\"favorite\":\"true\"}", "{\"favorite\":\"false\"}"})
    void updateFavorite_rejectsNonBooleanFavorite(String body) throws Exception {
        mockMvc.perform(patch("/api/reviews/r1/favorite").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("INVALID_INPUT"));

        verifyNoInteractions(reviewService);
    }

    @Test
    void createReview_mapsServiceValidationAndConflict() throws Exception {
        String body = "{\"name\":\"Cookie\",\"location\":\"Starbucks\",\"rating\":4,\"favorite\":false}";
        when(reviewService.createReview(any(), any(), any(), any(), any()))
            .thenThrow(new InvalidInputException("Invalid location: Starbucks"))
            .thenThrow(new ReviewConflictException("Cookie"));

        mockMvc.perform(post("/api/reviews").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Invalid location: Starbucks"));

        mockMvc.perform(post("/api/reviews").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("CONFLICT"));
    }

    @Test
    void getReviewById_returnsNotFoundForMissingOrDeleted() throws Exception {
        when(reviewService.getReviewById("r1")).thenReturn(hotChocolate());
        when(reviewService.getReviewById("gone")).thenThrow(ReviewNotFoundException.forId("gone"));

        mockMvc.perform(get("/api/reviews/r1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.name").value("Hot Chocolate"));

        mockMvc.perform(get("/api/reviews/gone"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }

    @Test
    void getReviewByName_delegatesToService() throws Exception {
        when(reviewService.getReviewByName("Hot Chocolate")).thenReturn(hotChocolate());

        mockMvc.perform(get("/api/reviews/by-name").param("name", "Hot Chocolate"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.id").value("r1"));
    }

    @Test
    void deleteReview_secondDeleteIsGone() throws Exception {
        doNothing().doThrow(new ReviewAlreadyDeletedException("r1")).when(reviewService).deleteReview("r1");

        mockMvc.perform(delete("/api/reviews/r1")).andExpect(status().isNoContent());
        mockMvc.perform(delete("/api/reviews/r1"))
            .andExpect(status().isGone())
            .andExpect(jsonPath("$.error").value("ALREADY_DELETED"));
    }

    @Test
    void updateRating_validatesRange() throws Exception {
        when(reviewService.updateRating("r1", 2)).thenReturn(hotChocolate().toBuilder().rating(2).build());

        mockMvc.perform(patch("/api/reviews/r1/rating")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"rating\":2}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.rating").value(2));

        mockMvc.perform(patch("/api/reviews/r1/rating")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"rating\":0}"))
            .andExpect(status().isBadRequest());

        verify(reviewService, never()).updateRating("r1", 0);
        verify(reviewService, times(1)).updateRating(any(), anyInt());
    }

    @Test
    void updateFavoriteAndText_delegateToService() throws Exception {
        when(reviewService.updateFavorite("r1", false)).thenReturn(hotChocolate().toBuilder().favorite(false).build());
        when(reviewService.updateReviewText("r1", "even better"))
            .thenReturn(hotChocolate().toBuilder().review("even better").build());

        mockMvc.perform(patch("/api/reviews/r1/favorite")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"favorite\":false}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.favorite").value(false));

        mockMvc.perform(patch("/api/reviews/r1/review")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"review\":\"even better\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.review").value("even better"));
    }

    @Test
    void getFavorites_listsRecords() throws Exception {
        when(reviewService.getFavorites()).thenReturn(List.of(hotChocolate()));

        mockMvc.perform(get("/api/reviews/favorites"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].name").value("Hot Chocolate"));
    }

    @Test
    void storageFailureIsServerError() throws Exception {
        when(reviewService.getFavorites()).thenThrow(
            new StorageException("Database error while listing favorite reviews",
                new DataAccessResourceFailureException("down")));

        mockMvc.perform(get("/api/reviews/favorites"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.error").value("STORAGE_ERROR"));
    }
}
