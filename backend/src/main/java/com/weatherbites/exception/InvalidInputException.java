package com.weatherbites.exception;

/**
 * Caller data was malformed or out of range. Always raised before any storage access.
 */
public class InvalidInputException extends WeatherBitesException {
    public InvalidInputException(String message) {
        super(ErrorKind.INVALID_INPUT, message);
    }
}
