package com.id.pibridge.modules.query.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PiQuerySummary {

    private String basis;
    private String interval;
    private String nodata;

    @Builder.Default
    private List<PiLabeledValue> types = new ArrayList<>();

}
