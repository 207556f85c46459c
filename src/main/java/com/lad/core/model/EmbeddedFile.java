package com.lad.core.model;

/**
 * A file read from disk and embedded into the review prompt.
 *
 * @param path    repo-relative path, forward slashes
 * @param content file text (possibly truncated by the loader)
 */
public record EmbeddedFile(String path, String content) {}
