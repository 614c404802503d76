package com.id.pibridge.modules.batch.model;

import com.id.pibridge.modules.batch.model.enums.PiBatchContentType;

import java.util.List;

/**
 * {@code Content.Items} holds one entry per stream, each with its own {@code Items}. Only the first stream is
 * read since every sub-request targets a single WebID.
 */
public record NestedItemsContent(String webId,
                                 String name,
                                 String path,
                                 String units,
                                 List<PiBatchContentItem> items) implements PiBatchContent {

    public NestedItemsContent {
        units = units == null ? "" : units;
        items = items == null ? List.of() : List.copyOf(items);
    }

    @Override
    public PiBatchContentType type() {
        return PiBatchContentType.NESTED_ITEMS;
    }
}
