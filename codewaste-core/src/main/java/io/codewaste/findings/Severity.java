package io.codewaste.findings;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Severity {
    LOW,
    MEDIUM;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
