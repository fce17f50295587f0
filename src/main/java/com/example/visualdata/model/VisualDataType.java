package com.example.visualdata.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum VisualDataType {
    PHOTO("photo"),
    VIDEO("video");

    private final String tag;

    VisualDataType(String tag) {
        this.tag = tag;
    }

    /**
     * Literal type tag handed to the rest of the pipeline.
     */
    @JsonValue
    public String tag() {
        return tag;
    }
}
