package com.id.pibridge.modules.query.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Label/value pair used by the query editor for attributes, segments and summary types.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PiLabeledValue {

    private String label;
    private PiSelectableValue value;

    public static PiLabeledValue of(String value) {
        return new PiLabeledValue(value, PiSelectableValue.builder().value(value).build());
    }
}
