package com.id.pibridge.modules.query.model;

import com.id.pibridge.modules.batch.model.BatchResponse;
import com.id.pibridge.modules.batch.model.BatchSubRequest;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One resolved target of a {@link PiQuery}. Lives for a single query-data call.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ProcessedQuery {

    private String label;
    private String fullTargetPath;
    private String datasourceUid;
    private boolean piPoint;
    private boolean streamable;
    private boolean digitalStates;
    private long intervalNanoSeconds;

    /** Null until resolution succeeds, and for calculations without a target */
    private String webId;
    /** Null until the sub-request can be built */
    private BatchSubRequest batchRequest;
    /** Null until the batch call answers for this entry */
    private BatchResponse response;
    /** Why the entry has no response, when it has none */
    private String failure;

    public boolean isResolved() {
        return batchRequest != null;
    }
}
