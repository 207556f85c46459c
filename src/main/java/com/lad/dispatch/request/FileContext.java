package com.lad.dispatch.request;

import com.lad.core.model.EmbeddedFile;

import java.util.List;

/**
 * Files read from disk for a review, plus the ones left out and why.
 */
public record FileContext(List<EmbeddedFile> embedded, List<SkippedFile> skipped) {

    public FileContext {
        embedded = List.copyOf(embedded);
        skipped = List.copyOf(skipped);
    }

    public static FileContext empty() {
        return new FileContext(List.of(), List.of());
    }

    public record SkippedFile(String path, String reason, String note) {

        public SkippedFile(String path, String reason) {
            this(path, reason, null);
        }
    }
}
