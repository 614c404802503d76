package com.id.pibridge.modules.query.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PiQuery {

    private String refId;
    private String queryType;
    private int maxDataPoints;
    /** Host polling interval, in milliseconds */
    private long intervalMs;
    private PiTimeRange timeRange;

    @Builder.Default
    private PiQueryOptions pi = new PiQueryOptions();

}
