package com.lad.core.review;

import com.lad.core.model.ErrorKind;

/**
 * Either a summary or the reason none could be produced.
 */
public record SynthesisResult(String summary, ErrorKind error, String errorDetail) {

    public static SynthesisResult of(String summary) {
        return new SynthesisResult(summary, null, null);
    }

    public static SynthesisResult failed(ErrorKind error, String detail) {
        return new SynthesisResult(null, error, detail);
    }

    public boolean succeeded() {
        return error == null;
    }
}
