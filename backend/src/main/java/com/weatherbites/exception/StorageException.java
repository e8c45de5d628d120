package com.weatherbites.exception;

/**
 * The persistence backend failed. Not retried; fatal for the current request.
 */
public class StorageException extends WeatherBitesException {
    public StorageException(String message, Throwable cause) {
        super(ErrorKind.STORAGE_ERROR, message, cause);
    }
}
