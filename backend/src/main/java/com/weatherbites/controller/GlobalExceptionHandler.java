package com.weatherbites.controller;

import com.weatherbites.dto.ErrorResponse;
import com.weatherbites.exception.ErrorKind;
import com.weatherbites.exception.WeatherBitesException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.LocalDateTime;
import java.util.stream.Collectors;

/**
 * Translates {@link ErrorKind}s and request-binding failures into JSON error bodies.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(WeatherBitesException.class)
    public ResponseEntity<ErrorResponse> handleWeatherBites(WeatherBitesException e) {
        if (e.getKind() == ErrorKind.STORAGE_ERROR) {
            log.error("Request failed: {}", e.getMessage(), e);
        }
        return respond(e.getKind(), e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .collect(Collectors.joining(", "));
        return respond(ErrorKind.INVALID_INPUT, message);
    }

    @ExceptionHandler({
        HttpMessageNotReadableException.class,
        MissingServletRequestParameterException.class,
        MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponse> handleUnreadableRequest(Exception e) {
        return respond(ErrorKind.INVALID_INPUT, "Malformed request: " + e.getMessage());
    }

    private static ResponseEntity<ErrorResponse> respond(ErrorKind kind, String message) {
        return ResponseEntity.status(kind.getStatus())
            .body(ErrorResponse.builder()
                .error(kind)
                .message(message)
                .timestamp(LocalDateTime.now())
                .build());
    }
}
