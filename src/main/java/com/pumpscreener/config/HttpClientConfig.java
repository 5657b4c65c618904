package com.pumpscreener.config;

import lombok.RequiredArgsConstructor;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
@RequiredArgsConstructor
public class HttpClientConfig {

    private final PumpScreenerProperties properties;

    @Bean
    public OkHttpClient okHttpClient() {
        Duration timeout = Duration.ofSeconds(properties.getBinance().getTimeoutSeconds());
        return new OkHttpClient.Builder()
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .callTimeout(timeout.multipliedBy(2))
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
