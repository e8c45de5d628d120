package com.weatherbites.exception;

/**
 * Base type for every failure raised by the core services. Each subclass maps to
 * exactly one {@link ErrorKind}.
 */
public abstract class WeatherBitesException extends RuntimeException {

    private final ErrorKind kind;

    protected WeatherBitesException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected WeatherBitesException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
