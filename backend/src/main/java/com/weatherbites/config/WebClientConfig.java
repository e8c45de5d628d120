package com.weatherbites.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.reactive.function.client.WebClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Outbound HTTP client settings. Applied to every {@code WebClient.Builder} Spring Boot hands
 * out, so calls are bounded by {@code openweathermap.timeout} at the connection level.
 */
@Configuration
public class WebClientConfig {

    @Bean
    public WebClientCustomizer timeoutWebClientCustomizer(@Value("${openweathermap.timeout:5s}") Duration timeout) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) timeout.toMillis())
            .doOnConnected(conn -> conn
                .addHandlerLast(new ReadTimeoutHandler(timeout.toMillis(), TimeUnit.MILLISECONDS)))
            .responseTimeout(timeout);

        return builder -> builder.clientConnector(new ReactorClientHttpConnector(httpClient));
    }
}
