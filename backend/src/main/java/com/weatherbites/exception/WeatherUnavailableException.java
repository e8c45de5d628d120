package com.weatherbites.exception;

public class WeatherUnavailableException extends WeatherBitesException {
    public WeatherUnavailableException(String city) {
        super(ErrorKind.WEATHER_UNAVAILABLE, "Could not fetch weather data for city: " + city);
    }
}
