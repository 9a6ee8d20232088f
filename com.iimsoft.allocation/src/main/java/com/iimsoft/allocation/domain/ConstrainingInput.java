package com.iimsoft.allocation.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which input bound the global limit of a period.
 */
public enum ConstrainingInput {
    A("A"),
    B("B"),
    LOOKAHEAD("lookahead");

    private final String label;

    ConstrainingInput(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() { return label; }
}
