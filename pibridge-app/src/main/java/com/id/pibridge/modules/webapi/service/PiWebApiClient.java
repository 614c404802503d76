package com.id.pibridge.modules.webapi.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.id.pibridge.config.AppConfig;
import com.id.pibridge.modules.batch.model.BatchSubRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.util.List;
import java.util.Map;

/**
 * Thin HTTP layer over the PI Web API. Paths handed in here are already query-escaped, so requests are
 * built from {@link URI} instances and never go through URI template expansion.
 */
@Service
@Slf4j
public class PiWebApiClient {

    private final RestTemplate restTemplate;
    private final AppConfig appConfig;
    private final ObjectMapper objectMapper;

    public PiWebApiClient(RestTemplate restTemplate, AppConfig appConfig, ObjectMapper objectMapper) {
        this.restTemplate = restTemplate;
        this.appConfig = appConfig;
        this.objectMapper = objectMapper;
    }

    public String getBaseUrl() {
        return stripTrailingSlash(appConfig.getWebApiBaseUrl());
    }

    /**
     * GET {@code <base><pathAndQuery>}.
     *
     * @param pathAndQuery - path relative to the base URL, including its escaped query string
     *
     * @return the raw response, status included
     */
    public ResponseEntity<String> get(String pathAndQuery) throws RestClientException {
        var uri = URI.create(getBaseUrl() + pathAndQuery);
        log.trace("GET {}", uri);
        return restTemplate.exchange(uri, HttpMethod.GET, new HttpEntity<>(jsonHeaders()), String.class);
    }

    /**
     * POST {@code <base>/batch} with the given sub-requests keyed by index.
     *
     * @return the raw batch response body
     */
    public String postBatch(Map<String, BatchSubRequest> subRequests) throws RestClientException {
        var uri = URI.create(getBaseUrl() + "/batch");
        String body;
        try {
            body = objectMapper.writeValueAsString(subRequests);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Batch request cannot be serialized", e);
        }
        log.trace("POST {} ({} sub-requests)", uri, subRequests.size());
        var headers = jsonHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        ResponseEntity<String> response = restTemplate.exchange(uri, HttpMethod.POST, new HttpEntity<>(body, headers), String.class);
        return response.getBody();
    }

    public JsonNode readTree(String body) throws JsonProcessingException {
        return objectMapper.readTree(body);
    }

    private static HttpHeaders jsonHeaders() {
        var headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        return headers;
    }

    private static String stripTrailingSlash(String url) {
        if (url == null) {
            return "";
        }
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
