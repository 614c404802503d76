package com.id.pibridge.modules.batch.model;

import java.util.Map;

public record BatchResponse(int status, Map<String, String> headers, PiBatchContent content) {

    public BatchResponse {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }
}
