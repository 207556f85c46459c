package com.lad.dispatch.request;

/**
 * Rejected review input. Transports report the message to the caller as-is.
 */
public class ReviewValidationException extends RuntimeException {

    public ReviewValidationException(String message) {
        super(message);
    }
}
