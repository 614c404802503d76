package com.id.pibridge.modules.batch.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One timestamped value as returned by the PI Web API. {@code value} is a number, a string, or a structured
 * object (digital states) and is kept as decoded.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class PiBatchContentItem {

    @JsonProperty("Timestamp")
    private String timestamp;

    @JsonProperty("Value")
    private Object value;

    @JsonProperty("UnitsAbbreviation")
    private String unitsAbbreviation;

    @JsonProperty("Good")
    private boolean good;

    @JsonProperty("Questionable")
    private boolean questionable;

    @JsonProperty("Substituted")
    private boolean substituted;

    @JsonProperty("Annotated")
    private boolean annotated;

}
