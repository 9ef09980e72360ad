package com.example.SmartDairy.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SourceKind {
    DOCUMENT("document"),
    WEB("web"),
    TABULAR("tabular");

    private final String value;

    SourceKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
