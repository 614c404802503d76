package com.id.pibridge.modules.batch.model;

import com.id.pibridge.modules.batch.model.enums.PiBatchContentType;

import java.util.List;

/**
 * {@code Content.Items} is the value list itself (calculations, single-stream reads).
 */
public record FlatItemsContent(String units, List<PiBatchContentItem> items) implements PiBatchContent {

    public FlatItemsContent {
        units = units == null ? "" : units;
        items = items == null ? List.of() : List.copyOf(items);
    }

    @Override
    public PiBatchContentType type() {
        return PiBatchContentType.FLAT_ITEMS;
    }
}
