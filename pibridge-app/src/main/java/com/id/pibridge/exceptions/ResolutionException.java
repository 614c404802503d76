package com.id.pibridge.exceptions;

import lombok.Getter;

/**
 * A hierarchical path could not be mapped to a WebID.
 */
@Getter
public class ResolutionException extends PiBridgeException {

    private final String path;

    public ResolutionException(String path, String message) {
        super("Could not resolve WebID for '%s': %s".formatted(path, message));
        this.path = path;
    }

    public ResolutionException(String path, String message, Throwable cause) {
        super("Could not resolve WebID for '%s': %s".formatted(path, message), cause);
        this.path = path;
    }
}
