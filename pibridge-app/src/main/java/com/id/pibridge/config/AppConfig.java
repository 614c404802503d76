package com.id.pibridge.config;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

@Configuration
@Getter
public class AppConfig {

    @Value("${pibridge.webapi.base-url:https://localhost/piwebapi}")
    private String webApiBaseUrl;

    @Value("${pibridge.webapi.username:}")
    private String webApiUsername;

    @Value("${pibridge.webapi.password:}")
    private String webApiPassword;

    @Value("${pibridge.webapi.connect-timeout-ms:5000}")
    private long webApiConnectTimeoutMs;

    @Value("${pibridge.webapi.read-timeout-ms:30000}")
    private long webApiReadTimeoutMs;

    @Value("${pibridge.datasource.uid:pibridge}")
    private String datasourceUid;

    @Value("${pibridge.webid-cache.ttl-ms:300000}")
    private long webIdCacheTtlMs;

    @Value("${pibridge.webid-cache.eviction-period-ms:300000}")
    private long webIdCacheEvictionPeriodMs;

    @Value("${pibridge.query.worker-threads:8}")
    private int queryWorkerThreads;

    @Value("${pibridge.query.queue-size:1000}")
    private int queryQueueSize;

    @Value("${pibridge.query.timeout-ms:60000}")
    private long queryTimeoutMs;
}
