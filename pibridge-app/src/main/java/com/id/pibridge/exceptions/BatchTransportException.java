package com.id.pibridge.exceptions;

/**
 * The batch call failed to send, or its top-level envelope failed to decode.
 */
public class BatchTransportException extends PiBridgeException {

    public BatchTransportException(String message) {
        super(message);
    }

    public BatchTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
