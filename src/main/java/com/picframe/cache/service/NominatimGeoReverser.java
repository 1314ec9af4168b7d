package com.picframe.cache.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.util.concurrent.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.List;
import java.util.Optional;

/**
 * Reverse geocoder backed by an OpenStreetMap Nominatim endpoint.
 * Calls are throttled by the shared geocoder rate limiter; any failure yields an empty result.
 */
public class NominatimGeoReverser implements GeoReverser {

    private static final Logger logger = LoggerFactory.getLogger(NominatimGeoReverser.class);

    private final RestTemplate restTemplate;
    private final RateLimiter rateLimiter;
    private final String baseUrl;
    private final String userAgent;
    private final String language;
    private final int zoom;

    public NominatimGeoReverser(RestTemplate restTemplate,
                                RateLimiter rateLimiter,
                                String baseUrl,
                                String userAgent,
                                String language,
                                int zoom) {
        this.restTemplate = restTemplate;
        this.rateLimiter = rateLimiter;
        this.baseUrl = baseUrl;
        this.userAgent = userAgent;
        this.language = language;
        this.zoom = zoom;
    }

    @Override
    @SuppressWarnings("UnstableApiUsage")
    public Optional<String> resolve(double latitude, double longitude) {
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .queryParam("format", "jsonv2")
                .queryParam("lat", latitude)
                .queryParam("lon", longitude)
                .queryParam("zoom", zoom)
                .queryParam("accept-language", language)
                .build()
                .toUri();

        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.USER_AGENT, userAgent);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        rateLimiter.acquire();
        try {
            ResponseEntity<JsonNode> response =
                    restTemplate.exchange(uri, HttpMethod.GET, new HttpEntity<>(headers), JsonNode.class);
            if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
                logger.warn("Reverse geocode for ({}, {}) returned status {}", latitude, longitude, response.getStatusCode());
                return Optional.empty();
            }
            return describe(response.getBody());
        } catch (RestClientException e) {
            logger.warn("Reverse geocode for ({}, {}) failed: {}", latitude, longitude, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Prefers a short "place, region, country" label and falls back to Nominatim's display name.
     */
    Optional<String> describe(JsonNode body) {
        if (body.hasNonNull("error")) {
            logger.debug("Nominatim had no answer: {}", body.get("error").asText());
            return Optional.empty();
        }
        JsonNode address = body.path("address");
        if (address.isObject()) {
            String place = firstText(address, "village", "town", "city", "municipality", "suburb", "hamlet");
            String region = firstText(address, "county", "state", "region");
            String country = firstText(address, "country");
            String label = joinNonBlank(place, region, country);
            if (StringUtils.hasText(label)) {
                return Optional.of(label);
            }
        }
        String displayName = body.path("display_name").asText("");
        return StringUtils.hasText(displayName) ? Optional.of(displayName) : Optional.empty();
    }

    private String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = node.path(field).asText("");
            if (StringUtils.hasText(value)) {
                return value;
            }
        }
        return null;
    }

    private String joinNonBlank(String... parts) {
        StringBuilder sb = new StringBuilder();
        for (String part : parts) {
            if (!StringUtils.hasText(part)) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(part);
        }
        return sb.toString();
    }
}
