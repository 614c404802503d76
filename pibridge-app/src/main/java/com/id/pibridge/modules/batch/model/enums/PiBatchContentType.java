package com.id.pibridge.modules.batch.model.enums;

public enum PiBatchContentType {
    ERROR,
    FLAT_ITEMS,
    NESTED_ITEMS
}
