package com.sandy.aiot.vision.sentinel.alert.rule;

/**
 * Parsed, validated body of an alert rule.
 */
public record RuleDefinition(RuleCondition condition, Schedule schedule, NotificationTargets targets) {

    public RuleDefinition {
        if (condition == null) throw new InvalidRuleException("condition is required");
        if (condition instanceof TimeWindowCondition && schedule == null) {
            throw new InvalidRuleException("timewindow rule requires a schedule");
        }
        targets = targets == null ? NotificationTargets.NONE : targets;
    }

    public RuleType type() {
        return condition.type();
    }
}
