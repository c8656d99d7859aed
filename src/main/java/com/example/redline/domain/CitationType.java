package com.example.redline.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CitationType {
    USC("usc"),
    CFR("cfr"),
    PUBLAW("publaw");

    private final String code;

    CitationType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
