package com.infergate.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Terminal classification of why generation stopped.
 */
public enum FinishReason {

    STOP("stop"),
    LENGTH("length"),
    TOOL_CALLS("tool_calls"),
    CONTENT_FILTER("content_filter");

    private final String value;

    FinishReason(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Resolve a wire value. Returns null for null or unrecognised input so callers pick the fallback.
     */
    @JsonCreator
    public static FinishReason fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (FinishReason reason : values()) {
            if (reason.value.equalsIgnoreCase(value.trim())) {
                return reason;
            }
        }
        return null;
    }
}
