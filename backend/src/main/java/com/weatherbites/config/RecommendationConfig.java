package com.weatherbites.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.util.Random;

@Configuration
public class RecommendationConfig {

    /** Uniform source for snack pairings. */
    @Bean
    public Random pairingRandom() {
        return new SecureRandom();
    }
}
