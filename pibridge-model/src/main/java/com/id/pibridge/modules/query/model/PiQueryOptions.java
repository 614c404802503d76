package com.id.pibridge.modules.query.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Query payload as produced by the query editor. Attributes, segments, elementPath, display and hide
 * are only meaningful to the editor and are carried through untouched.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class PiQueryOptions {

    /** {@code <base>;<leaf1>;<leaf2>...} */
    private String target;
    private String expression;
    private String elementPath;
    private String display;
    private boolean hide;

    @JsonProperty("isPiPoint")
    private boolean piPoint;

    private int intervalMs;
    private int maxDataPoints;

    @Builder.Default
    private PiToggle interpolate = PiToggle.off();
    @Builder.Default
    private PiRecordedValues recordedValues = new PiRecordedValues();
    @Builder.Default
    private PiToggle regex = PiToggle.off();
    @Builder.Default
    private PiToggle digitalStates = PiToggle.off();

    @JsonProperty("EnableStreaming")
    @Builder.Default
    private PiToggle enableStreaming = PiToggle.off();

    @Builder.Default
    private PiQuerySummary summary = new PiQuerySummary();

    @Builder.Default
    private List<PiLabeledValue> attributes = new ArrayList<>();
    @Builder.Default
    private List<PiLabeledValue> segments = new ArrayList<>();

}
