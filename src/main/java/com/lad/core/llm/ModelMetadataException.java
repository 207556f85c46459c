package com.lad.core.llm;

/**
 * Thrown when model capabilities cannot be determined: the listing could not be fetched
 * and no usable cached entry exists, or the model is absent from the listing.
 */
public class ModelMetadataException extends RuntimeException {

    public ModelMetadataException(String message) {
        super(message);
    }

    public ModelMetadataException(String message, Throwable cause) {
        super(message, cause);
    }
}
