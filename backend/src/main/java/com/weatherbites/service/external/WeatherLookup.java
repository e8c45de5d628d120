package com.weatherbites.service.external;

import java.util.OptionalDouble;

/**
 * Source of current temperatures, in degrees Fahrenheit.
 */
public interface WeatherLookup {

    /**
     * @param city city name as typed by the user
     * @return the current temperature, or empty when no reading could be obtained
     */
    OptionalDouble currentTemperature(String city);
}
