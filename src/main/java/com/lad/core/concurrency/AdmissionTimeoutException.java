package com.lad.core.concurrency;

/**
 * Thrown when a caller's deadline passes while it waits for an admission permit.
 */
public class AdmissionTimeoutException extends RuntimeException {

    public AdmissionTimeoutException(String message) {
        super(message);
    }
}
