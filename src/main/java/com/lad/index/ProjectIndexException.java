package com.lad.index;

/**
 * Tool-level failure from a {@link ProjectIndex}. The message is shown to the model,
 * so it must not carry secrets or absolute host paths beyond the project root.
 */
public class ProjectIndexException extends RuntimeException {

    public ProjectIndexException(String message) {
        super(message);
    }

    public ProjectIndexException(String message, Throwable cause) {
        super(message, cause);
    }
}
