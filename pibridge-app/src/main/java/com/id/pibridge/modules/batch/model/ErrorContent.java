package com.id.pibridge.modules.batch.model;

import com.id.pibridge.modules.batch.model.enums.PiBatchContentType;
import com.id.pibridge.modules.batch.model.enums.PiBatchErrorReason;

import java.util.List;

public record ErrorContent(PiBatchErrorReason reason, List<String> errors) implements PiBatchContent {

    public static final String UNPROCESSABLE_MESSAGE = "Could not process response from PI Web API";

    public ErrorContent {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static ErrorContent remote(List<String> errors) {
        return new ErrorContent(PiBatchErrorReason.REMOTE_API, errors);
    }

    public static ErrorContent unprocessable() {
        return new ErrorContent(PiBatchErrorReason.RESPONSE_SHAPE, List.of(UNPROCESSABLE_MESSAGE));
    }

    public static ErrorContent unresolved(String message) {
        return new ErrorContent(PiBatchErrorReason.UNRESOLVED, message == null ? List.of() : List.of(message));
    }

    @Override
    public PiBatchContentType type() {
        return PiBatchContentType.ERROR;
    }

    @Override
    public String units() {
        return "";
    }

    @Override
    public List<PiBatchContentItem> items() {
        return List.of();
    }
}
