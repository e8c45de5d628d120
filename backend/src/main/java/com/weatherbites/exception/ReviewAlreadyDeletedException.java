package com.weatherbites.exception;

public class ReviewAlreadyDeletedException extends WeatherBitesException {
    public ReviewAlreadyDeletedException(String id) {
        super(ErrorKind.ALREADY_DELETED, "Review with ID " + id + " has already been deleted");
    }
}
