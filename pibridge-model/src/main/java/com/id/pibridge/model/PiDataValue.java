package com.id.pibridge.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PiDataValue {

    private String timestamp;
    private Object value;
    private String units;
    private boolean good;
    private boolean questionable;
    private boolean substituted;
    private boolean annotated;

}
