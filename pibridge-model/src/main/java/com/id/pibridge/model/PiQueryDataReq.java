package com.id.pibridge.model;

import com.id.pibridge.modules.query.model.PiQuery;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PiQueryDataReq {

    private String datasourceUid;
    private List<PiQuery> queries;

}
