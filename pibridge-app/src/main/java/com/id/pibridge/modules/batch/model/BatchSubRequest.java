package com.id.pibridge.modules.batch.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BatchSubRequest {

    public static final String GET = "GET";

    @JsonProperty("Method")
    private String method;

    @JsonProperty("Resource")
    private String resource;

    public static BatchSubRequest get(String resource) {
        return new BatchSubRequest(GET, resource);
    }
}
