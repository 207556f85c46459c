package com.lad.core.llm;

/**
 * Thrown when a model call fails at the transport level or returns an unusable response.
 */
public class TransportException extends RuntimeException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
