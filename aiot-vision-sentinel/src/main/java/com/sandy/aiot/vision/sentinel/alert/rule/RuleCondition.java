package com.sandy.aiot.vision.sentinel.alert.rule;

import java.util.List;

/**
 * Type-specific part of an alert rule.
 */
public sealed interface RuleCondition permits ThresholdCondition, NoDataCondition, TimeWindowCondition {

    RuleType type();

    List<Long> deviceIds();
}
