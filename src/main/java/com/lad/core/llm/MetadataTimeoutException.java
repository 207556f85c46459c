package com.lad.core.llm;

/**
 * Thrown when the caller's deadline passes while it waits for the model listing.
 */
public class MetadataTimeoutException extends ModelMetadataException {

    public MetadataTimeoutException(String message) {
        super(message);
    }
}
