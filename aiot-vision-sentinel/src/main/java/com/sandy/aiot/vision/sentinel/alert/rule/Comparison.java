package com.sandy.aiot.vision.sentinel.alert.rule;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/** Comparator of a threshold rule: {@code actual <op> threshold}. */
public enum Comparison {
    GT("gt") {
        @Override
        public boolean test(double actual, double threshold) { return actual > threshold; }
    },
    LT("lt") {
        @Override
        public boolean test(double actual, double threshold) { return actual < threshold; }
    },
    GTE("gte") {
        @Override
        public boolean test(double actual, double threshold) { return actual >= threshold; }
    },
    LTE("lte") {
        @Override
        public boolean test(double actual, double threshold) { return actual <= threshold; }
    },
    EQ("eq") {
        @Override
        public boolean test(double actual, double threshold) { return actual == threshold; }
    };

    private final String code;

    Comparison(String code) {
        this.code = code;
    }

    public abstract boolean test(double actual, double threshold);

    @JsonValue
    public String code() {
        return code;
    }

    public static Comparison fromCode(String code) {
        return Arrays.stream(values())
                .filter(c -> c.code.equals(code))
                .findFirst()
                .orElseThrow(() -> new InvalidRuleException("unknown comparator: " + code));
    }
}
