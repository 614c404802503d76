package com.id.pibridge.model;

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
public class PiDataFrame {

    private String name;
    private String refId;
    private String units;
    private String executedQueryString;
    private String channel;

    @Builder.Default
    private List<String> notices = new ArrayList<>();
    @Builder.Default
    private List<PiDataValue> values = new ArrayList<>();

}
