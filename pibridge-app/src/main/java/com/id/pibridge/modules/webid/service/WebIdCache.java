package com.id.pibridge.modules.webid.service;

import com.id.pibridge.config.AppConfig;
import com.id.pibridge.modules.webid.model.WebIdCacheEntry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Full hierarchical path to WebID. Entries older than the TTL are never served, and the whole table is
 * cleared periodically by the orchestrator.
 */
@Service
public class WebIdCache {

    private final Map<String, WebIdCacheEntry> entries = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Duration ttl;
    private final Clock clock;

    @Autowired
    public WebIdCache(AppConfig appConfig) {
        this(Duration.ofMillis(appConfig.getWebIdCacheTtlMs()), Clock.systemUTC());
    }

    public WebIdCache(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
    }

    public Optional<String> get(String path) {
        lock.lock();
        try {
            var entry = entries.get(path);
            if (entry == null) {
                return Optional.empty();
            }
            if (isExpired(entry, clock.instant())) {
                entries.remove(path);
                return Optional.empty();
            }
            return Optional.of(entry.webId());
        } finally {
            lock.unlock();
        }
    }

    public void put(String path, String webId) {
        lock.lock();
        try {
            entries.put(path, new WebIdCacheEntry(webId, clock.instant()));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every entry.
     *
     * @return number of entries removed
     */
    public int evictAll() {
        lock.lock();
        try {
            int removed = entries.size();
            entries.clear();
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    private boolean isExpired(WebIdCacheEntry entry, Instant now) {
        return !entry.createdAt().plus(ttl).isAfter(now);
    }
}
