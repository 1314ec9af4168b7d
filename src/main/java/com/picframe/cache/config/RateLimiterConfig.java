package com.picframe.cache.config;

import com.google.common.util.concurrent.RateLimiter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RateLimiterConfig {

    @Value("${app.picframe.geo.qps:1.0}") // Nominatim allows one request per second
    private double geocoderQps;

    @Bean("geocoderRateLimiter")
    @SuppressWarnings("UnstableApiUsage")
    public RateLimiter geocoderRateLimiter() {
        return RateLimiter.create(Math.max(0.1, geocoderQps));
    }
}
