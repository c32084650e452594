package com.summaryplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One generated sentence and its validity degree.
 *
 * <p>{@code text} may carry {@code <b>…</b>} spans that renderers show as
 * emphasis. {@code validity} is always within [0, 1].
 */
public record Summary(
    @JsonProperty("text") String text,
    @JsonProperty("validity") double validity
) {
    public Summary {
        if (text == null) {
            throw new IllegalArgumentException("Summary text must not be null");
        }
        if (Double.isNaN(validity) || validity < 0.0 || validity > 1.0) {
            throw new IllegalArgumentException("Summary validity out of [0, 1]: " + validity);
        }
    }

    public static Summary of(String text, double validity) {
        return new Summary(text, validity);
    }
}
