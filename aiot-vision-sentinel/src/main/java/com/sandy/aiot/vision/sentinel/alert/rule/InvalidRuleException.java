package com.sandy.aiot.vision.sentinel.alert.rule;

/**
 * Rule JSON that is missing a required field or carries an unknown type/comparator.
 */
public class InvalidRuleException extends RuntimeException {
    public InvalidRuleException(String message) {
        super(message);
    }

    public InvalidRuleException(String message, Throwable cause) {
        super(message, cause);
    }
}
