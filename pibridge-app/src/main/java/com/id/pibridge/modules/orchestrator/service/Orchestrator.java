package com.id.pibridge.modules.orchestrator.service;

import com.id.pibridge.modules.webid.service.WebIdCache;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background housekeeping. Scheduled tasks stop with the application context.
 */
@Service
@Slf4j
public class Orchestrator {

    private final WebIdCache webIdCache;
    private final AtomicBoolean webIdCacheEvictionRunning = new AtomicBoolean(false);

    public Orchestrator(WebIdCache webIdCache) {
        this.webIdCache = webIdCache;
    }

    @Scheduled(
            fixedRateString = "${pibridge.webid-cache.eviction-period-ms:300000}",
            initialDelayString = "${pibridge.webid-cache.eviction-period-ms:300000}"
    )
    public void evictWebIdCache() {
        if (webIdCacheEvictionRunning.compareAndSet(false, true)) {
            try {
                int removed = webIdCache.evictAll();
                log.debug("WebID cache cleared, {} entries removed", removed);
            } catch (Exception ex) {
                log.error("Error during WebID cache eviction", ex);
            } finally {
                webIdCacheEvictionRunning.set(false);
            }
        }
    }
}
