package com.weatherbites.exception;

import org.springframework.http.HttpStatus;

/**
 * Closed set of failure categories surfaced by the recommendation and review services.
 */
public enum ErrorKind {
    INVALID_INPUT(HttpStatus.BAD_REQUEST),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    ALREADY_DELETED(HttpStatus.GONE),
    CONFLICT(HttpStatus.CONFLICT),
    WEATHER_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE),
    STORAGE_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    ErrorKind(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
