package com.sandy.aiot.vision.sentinel.alert.rule;

import java.util.List;

/**
 * A watched device is silent when it produced no sample of any key in the last {@code durationSec}.
 */
public record NoDataCondition(List<Long> deviceIds, long durationSec) implements RuleCondition {

    public NoDataCondition {
        if (deviceIds == null || deviceIds.isEmpty()) throw new InvalidRuleException("device_ids must not be empty");
        if (durationSec <= 0) throw new InvalidRuleException("duration_sec must be > 0");
        deviceIds = List.copyOf(deviceIds);
    }

    @Override
    public RuleType type() {
        return RuleType.NODATA;
    }
}
