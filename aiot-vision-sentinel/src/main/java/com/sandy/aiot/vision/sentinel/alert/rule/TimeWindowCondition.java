package com.sandy.aiot.vision.sentinel.alert.rule;

import java.util.List;

/**
 * Threshold logic that only runs inside the rule's schedule; the schedule is mandatory.
 */
public record TimeWindowCondition(ThresholdCondition threshold) implements RuleCondition {

    public TimeWindowCondition {
        if (threshold == null) throw new InvalidRuleException("threshold part is required");
    }

    @Override
    public RuleType type() {
        return RuleType.TIMEWINDOW;
    }

    @Override
    public List<Long> deviceIds() {
        return threshold.deviceIds();
    }
}
