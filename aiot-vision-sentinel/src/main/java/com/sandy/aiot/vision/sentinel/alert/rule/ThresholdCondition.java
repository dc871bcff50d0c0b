package com.sandy.aiot.vision.sentinel.alert.rule;

import java.util.List;

/**
 * Fires once {@code key <op> value} has held without interruption for {@code durationSec}.
 */
public record ThresholdCondition(List<Long> deviceIds, String key, Comparison op, double value, long durationSec)
        implements RuleCondition {

    public ThresholdCondition {
        if (deviceIds == null || deviceIds.isEmpty()) throw new InvalidRuleException("device_ids must not be empty");
        if (key == null || key.isBlank()) throw new InvalidRuleException("key is required");
        if (op == null) throw new InvalidRuleException("op is required");
        if (durationSec < 0) throw new InvalidRuleException("duration_sec must be >= 0");
        deviceIds = List.copyOf(deviceIds);
    }

    @Override
    public RuleType type() {
        return RuleType.THRESHOLD;
    }

    /** Human readable form used in payloads, e.g. "power gt 1000.0". */
    public String describe() {
        return key + " " + op.code() + " " + value;
    }
}
