package com.id.pibridge.modules.query.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PiRecordedValues {

    private boolean enable;
    private int maxNumber;

}
