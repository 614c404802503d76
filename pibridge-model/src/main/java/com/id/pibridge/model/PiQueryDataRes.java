package com.id.pibridge.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PiQueryDataRes {

    /** Frames by RefID, in request order */
    @Builder.Default
    private Map<String, List<PiDataFrame>> responses = new LinkedHashMap<>();

}
