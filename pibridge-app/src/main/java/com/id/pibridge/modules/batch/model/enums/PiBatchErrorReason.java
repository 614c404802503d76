package com.id.pibridge.modules.batch.model.enums;

public enum PiBatchErrorReason {
    /** The remote API answered the sub-request with a non-200 status */
    REMOTE_API,
    /** The sub-response content matched none of the known shapes */
    RESPONSE_SHAPE,
    /** No sub-response arrived: resolution failed, the batch call failed, or it was cancelled */
    UNRESOLVED
}
