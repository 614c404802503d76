package com.id.pibridge.modules.webid.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.id.pibridge.exceptions.ResolutionException;
import com.id.pibridge.modules.query.logic.QueryUriBuilder;
import com.id.pibridge.modules.webapi.service.PiWebApiClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;

@Service
@Slf4j
public class WebIdResolver {

    private final PiWebApiClient piWebApiClient;
    private final WebIdCache webIdCache;

    public WebIdResolver(PiWebApiClient piWebApiClient, WebIdCache webIdCache) {
        this.piWebApiClient = piWebApiClient;
        this.webIdCache = webIdCache;
    }

    /**
     * Resolves a hierarchical path to its WebID, going to the remote API only on a cache miss.
     *
     * @param fullPath  - full point or attribute path
     * @param isPiPoint - true for PI points, false for AF elements and attributes
     *
     * @return the WebID
     * @throws ResolutionException when the lookup fails or yields no WebID
     */
    public String resolve(String fullPath, boolean isPiPoint) {
        var cached = webIdCache.get(fullPath);
        if (cached.isPresent()) {
            return cached.get();
        }

        String webId = fetch(fullPath, isPiPoint);
        webIdCache.put(fullPath, webId);
        return webId;
    }

    private String fetch(String fullPath, boolean isPiPoint) {
        var lookupPath = lookupPath(fullPath, isPiPoint);
        log.debug("Resolving WebID for {}", fullPath);

        String body;
        try {
            var response = piWebApiClient.get(lookupPath);
            if (response.getStatusCode().value() != HttpStatus.OK.value()) {
                throw new ResolutionException(fullPath, "got response code %d".formatted(response.getStatusCode().value()));
            }
            body = response.getBody();
        } catch (RestClientException e) {
            throw new ResolutionException(fullPath, e.getMessage(), e);
        }
        if (body == null || body.isBlank()) {
            throw new ResolutionException(fullPath, "empty response");
        }

        try {
            var webId = piWebApiClient.readTree(body).path("WebId");
            if (!webId.isTextual() || webId.asText().isBlank()) {
                throw new ResolutionException(fullPath, "response carries no WebId");
            }
            return webId.asText();
        } catch (JsonProcessingException e) {
            throw new ResolutionException(fullPath, "malformed response", e);
        }
    }

    /**
     * Lookup endpoint for a path: points for PI points, attributes for {@code |} paths, elements otherwise.
     */
    static String lookupPath(String fullPath, boolean isPiPoint) {
        String endpoint;
        if (isPiPoint) {
            endpoint = "/points";
        } else if (fullPath.contains("|")) {
            endpoint = "/attributes";
        } else {
            endpoint = "/elements";
        }
        return endpoint + "?path=" + QueryUriBuilder.escape(fullPath);
    }
}
