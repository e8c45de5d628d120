package com.weatherbites.exception;

public class ReviewNotFoundException extends WeatherBitesException {
    public ReviewNotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }

    public static ReviewNotFoundException forId(String id) {
        return new ReviewNotFoundException("Review with ID " + id + " not found");
    }

    public static ReviewNotFoundException forName(String name) {
        return new ReviewNotFoundException("Review with name " + name + " not found");
    }
}
