package com.sandy.aiot.vision.sentinel.alert.rule;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum RuleType {
    THRESHOLD("threshold"),
    NODATA("nodata"),
    TIMEWINDOW("timewindow");

    private final String code;

    RuleType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public static RuleType fromCode(String code) {
        return Arrays.stream(values())
                .filter(t -> t.code.equals(code))
                .findFirst()
                .orElseThrow(() -> new InvalidRuleException("unknown rule type: " + code));
    }
}
