package com.id.pibridge.modules.query.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PiSelectableValue {

    private String value;
    private boolean expandable;
    private String webId;

}
