package com.id.pibridge.modules.batch.model;

import com.id.pibridge.modules.batch.model.enums.PiBatchContentType;

import java.util.List;

/**
 * Classified content of one batch sub-response: {@link ErrorContent}, {@link FlatItemsContent} or
 * {@link NestedItemsContent}.
 */
public interface PiBatchContent {

    PiBatchContentType type();

    String units();

    List<PiBatchContentItem> items();
}
