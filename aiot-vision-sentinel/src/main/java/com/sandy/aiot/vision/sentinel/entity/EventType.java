package com.sandy.aiot.vision.sentinel.entity;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EventType {
    SPIKE("spike"),
    SAG("sag");

    private final String code;

    EventType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
