package com.id.pibridge.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Configuration
public class RestClientConfig {

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, AppConfig appConfig) {
        var configured = builder
                .connectTimeout(Duration.ofMillis(appConfig.getWebApiConnectTimeoutMs()))
                .readTimeout(Duration.ofMillis(appConfig.getWebApiReadTimeoutMs()));
        if (StringUtils.hasText(appConfig.getWebApiUsername())) {
            configured = configured.basicAuthentication(appConfig.getWebApiUsername(), appConfig.getWebApiPassword());
        }
        return configured.build();
    }
}
