package com.id.pibridge.modules.webid.model;

import java.time.Instant;

public record WebIdCacheEntry(String webId, Instant createdAt) {
}
