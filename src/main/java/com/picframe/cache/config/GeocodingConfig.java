package com.picframe.cache.config;

import com.google.common.util.concurrent.RateLimiter;
import com.picframe.cache.service.GeoReverser;
import com.picframe.cache.service.NoOpGeoReverser;
import com.picframe.cache.service.NominatimGeoReverser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Configuration
public class GeocodingConfig {

    private static final Logger logger = LoggerFactory.getLogger(GeocodingConfig.class);

    @Value("${app.picframe.geo.enabled:false}")
    private boolean enabled;
    @Value("${app.picframe.geo.url:https://nominatim.openstreetmap.org/reverse}")
    private String url;
    @Value("${app.picframe.geo.user-agent:picframe-cache}")
    private String userAgent;
    @Value("${app.picframe.geo.language:en}")
    private String language;
    @Value("${app.picframe.geo.zoom:18}")
    private int zoom;
    @Value("${app.picframe.geo.timeout-ms:5000}")
    private long timeoutMs;

    @Bean("geocoderRestTemplate")
    public RestTemplate geocoderRestTemplate(RestTemplateBuilder builder) {
        Duration timeout = Duration.ofMillis(timeoutMs);
        return builder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .build();
    }

    @Bean
    public GeoReverser geoReverser(@Qualifier("geocoderRestTemplate") RestTemplate restTemplate,
                                   @Qualifier("geocoderRateLimiter") RateLimiter rateLimiter) {
        if (!enabled) {
            logger.info("Reverse geocoding disabled");
            return new NoOpGeoReverser();
        }
        logger.info("Reverse geocoding through {}", url);
        return new NominatimGeoReverser(restTemplate, rateLimiter, url, userAgent, language, zoom);
    }
}
