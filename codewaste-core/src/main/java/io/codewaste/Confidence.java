package io.codewaste;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Confidence tier derived from thresholding a continuous score.
 */
public enum Confidence {
    HIGH,
    MEDIUM;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
