package com.perptrader.backend.service.client;

import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Map;

/**
 * Thin wrapper over {@link RestTemplate} shared by the exchange, market data and coin pool clients.
 */
@Service
public class HttpClientService {

    private final RestTemplate restTemplate;

    public HttpClientService(RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    /**
     * GET with query parameters encoded by Spring.
     */
    public <T> ResponseEntity<T> get(String url, HttpHeaders headers, Class<T> responseType, Map<String, String> params) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(url);
        if (params != null) {
            params.forEach(builder::queryParam);
        }
        return restTemplate.exchange(builder.build().toUri(), HttpMethod.GET, new HttpEntity<>(headers), responseType);
    }

    /**
     * POST a body (serialized by the configured message converters).
     */
    public <T> ResponseEntity<T> post(String url, HttpHeaders headers, Object body, Class<T> responseType) {
        return restTemplate.exchange(url, HttpMethod.POST, new HttpEntity<>(body, headers), responseType);
    }

    /**
     * Sends a request whose query string is already built and must reach the server byte for byte,
     * as required when the query carries a signature over its own text.
     */
    public <T> ResponseEntity<T> exchangeSigned(HttpMethod method, String baseUrl, String path, String queryString,
                                                HttpHeaders headers, Class<T> responseType) {
        String url = baseUrl + path + (queryString == null || queryString.isEmpty() ? "" : "?" + queryString);
        return restTemplate.exchange(URI.create(url), method, new HttpEntity<>(headers), responseType);
    }
}
