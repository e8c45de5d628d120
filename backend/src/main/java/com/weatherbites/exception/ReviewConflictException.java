package com.weatherbites.exception;

/**
 * A review with the same name already exists, live or soft-deleted.
 */
public class ReviewConflictException extends WeatherBitesException {
    public ReviewConflictException(String name) {
        super(ErrorKind.CONFLICT, "Snack with name '" + name + "' already exists");
    }

    public ReviewConflictException(String name, Throwable cause) {
        super(ErrorKind.CONFLICT, "Snack with name '" + name + "' already exists", cause);
    }
}
