package com.example.redline.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AmendmentKind {
    STRIKE_INSERT,
    STRIKE_REDESIGNATE,
    REDESIGNATE,
    DESIGNATE,
    INSERT_AFTER,
    INSERT_BEFORE,
    READ_AS_FOLLOWS,
    ADD_AT_END,
    ADD_AT_BEGINNING,
    EACH_PLACE_APPEARS,
    STRIKE,
    FURTHER_AMENDED,
    UNKNOWN;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String displayName() {
        return code().replace('_', ' ');
    }
}
