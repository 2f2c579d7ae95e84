package com.athena.canaryservice.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ModelVariant {
    STABLE("stable"),
    CANARY("canary");

    private final String tag;

    ModelVariant(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }
}
