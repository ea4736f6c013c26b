package com.stormcell.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Morphology of a storm cell as derived from its fitted eccentricity.
 */
public enum ShapeType {
    SINGLE_CELL("single cell"),
    MULTI_CELL("multicell");

    private final String label;

    ShapeType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
