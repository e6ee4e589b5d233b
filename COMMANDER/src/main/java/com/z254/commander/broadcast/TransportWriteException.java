package com.z254.commander.broadcast;

/**
 * Raised by a transport that could not accept an outbound frame.
 */
public class TransportWriteException extends RuntimeException {

    public TransportWriteException(String message) {
        super(message);
    }

    public TransportWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
