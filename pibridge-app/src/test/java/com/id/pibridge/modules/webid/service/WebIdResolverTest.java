package com.id.pibridge.modules.webid.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.id.pibridge.config.AppConfig;
import com.id.pibridge.exceptions.ResolutionException;
import com.id.pibridge.modules.webapi.service.PiWebApiClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.time.Clock;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.lenient;
import static org.springframework.test.web.client.ExpectedCount.once;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@ExtendWith(MockitoExtension.class)
class WebIdResolverTest {

    private static final String BASE = "https://pi.example.com/piwebapi";
    private static final String ATTRIBUTE_PATH = "\\\\af\\db\\Plant|Pressure";
    private static final String ATTRIBUTE_LOOKUP = BASE + "/attributes?path=%5C%5Caf%5Cdb%5CPlant%7CPressure";

    @Mock
    private AppConfig appConfig;

    private MockRestServiceServer server;
    private WebIdCache cache;
    private WebIdResolver resolver;

    @BeforeEach
    void setUp() {
        lenient().when(appConfig.getWebApiBaseUrl()).thenReturn(BASE);
        var restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        cache = new WebIdCache(Duration.ofMinutes(5), Clock.systemUTC());
        resolver = new WebIdResolver(new PiWebApiClient(restTemplate, appConfig, new ObjectMapper()), cache);
    }

    @Test
    void shouldResolveOnceAndServeFromCache() {
        server.expect(once(), requestTo(ATTRIBUTE_LOOKUP))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("{\"WebId\":\"F1AbEattr\",\"Name\":\"Pressure\"}", MediaType.APPLICATION_JSON));

        assertEquals("F1AbEattr", resolver.resolve(ATTRIBUTE_PATH, false));
        assertEquals("F1AbEattr", resolver.resolve(ATTRIBUTE_PATH, false));

        server.verify();
    }

    @Test
    void shouldResolveAgainAfterEviction() {
        server.expect(once(), requestTo(ATTRIBUTE_LOOKUP))
                .andRespond(withSuccess("{\"WebId\":\"first\"}", MediaType.APPLICATION_JSON));
        server.expect(once(), requestTo(ATTRIBUTE_LOOKUP))
                .andRespond(withSuccess("{\"WebId\":\"second\"}", MediaType.APPLICATION_JSON));

        assertEquals("first", resolver.resolve(ATTRIBUTE_PATH, false));
        cache.evictAll();
        assertEquals("second", resolver.resolve(ATTRIBUTE_PATH, false));

        server.verify();
    }

    @Test
    void shouldUsePointEndpointForPiPoints() {
        server.expect(once(), requestTo(BASE + "/points?path=%5C%5Cpiserver%5Csinusoid"))
                .andRespond(withSuccess("{\"WebId\":\"F1DPpoint\"}", MediaType.APPLICATION_JSON));

        assertEquals("F1DPpoint", resolver.resolve("\\\\piserver\\sinusoid", true));

        server.verify();
    }

    @Test
    void shouldUseElementEndpointForElementPaths() {
        assertEquals("/elements?path=%5C%5Caf%5Cdb%5CPlant", WebIdResolver.lookupPath("\\\\af\\db\\Plant", false));
    }

    @Test
    void shouldFailOnNotFoundAndCacheNothing() {
        server.expect(once(), requestTo(ATTRIBUTE_LOOKUP))
                .andRespond(withStatus(HttpStatus.NOT_FOUND)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"Errors\":[\"Path not found\"]}"));

        var ex = assertThrows(ResolutionException.class, () -> resolver.resolve(ATTRIBUTE_PATH, false));

        assertEquals(ATTRIBUTE_PATH, ex.getPath());
        assertEquals(0, cache.size());
        server.verify();
    }

    @Test
    void shouldFailWhenResponseHasNoWebId() {
        server.expect(once(), requestTo(ATTRIBUTE_LOOKUP))
                .andRespond(withSuccess("{\"Name\":\"Pressure\"}", MediaType.APPLICATION_JSON));

        assertThrows(ResolutionException.class, () -> resolver.resolve(ATTRIBUTE_PATH, false));
    }
}
