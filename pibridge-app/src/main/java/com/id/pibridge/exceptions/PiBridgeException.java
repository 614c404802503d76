package com.id.pibridge.exceptions;

public class PiBridgeException extends RuntimeException {

    public PiBridgeException(String message) {
        super(message);
    }

    public PiBridgeException(String message, Throwable cause) {
        super(message, cause);
    }
}
