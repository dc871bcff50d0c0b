package com.sandy.aiot.vision.sentinel.alert.rule;

import java.util.Arrays;
import java.util.List;

/**
 * Canned rule shapes offered to the management layer.
 */
public enum AlertPreset {
    HIGH_DRAW("high_draw"),
    OVER_TEMP("over_temp"),
    NO_DATA("no_data");

    private static final int DEFAULT_NO_DATA_MINUTES = 5;

    private final String code;

    AlertPreset(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static AlertPreset fromCode(String code) {
        return Arrays.stream(values())
                .filter(p -> p.code.equals(code))
                .findFirst()
                .orElseThrow(() -> new InvalidRuleException("unknown preset type: " + code));
    }

    public record Built(String name, RuleDefinition definition) {}

    /**
     * @param threshold       required by high_draw / over_temp
     * @param durationMinutes no_data only, defaults to 5
     */
    public Built build(List<Long> deviceIds, Double threshold, Schedule schedule, Integer durationMinutes) {
        switch (this) {
            case HIGH_DRAW -> {
                double t = requireThreshold(threshold);
                return new Built(String.format("High Power Draw (> %sW)", format(t)),
                        new RuleDefinition(new ThresholdCondition(deviceIds, "power", Comparison.GT, t, 120), schedule, NotificationTargets.NONE));
            }
            case OVER_TEMP -> {
                double t = requireThreshold(threshold);
                return new Built(String.format("Over Temperature (> %s°C)", format(t)),
                        new RuleDefinition(new ThresholdCondition(deviceIds, "temp", Comparison.GT, t, 60), schedule, NotificationTargets.NONE));
            }
            default -> {
                int minutes = durationMinutes == null ? DEFAULT_NO_DATA_MINUTES : durationMinutes;
                return new Built(String.format("No Data (%d minutes)", minutes),
                        new RuleDefinition(new NoDataCondition(deviceIds, minutes * 60L), null, NotificationTargets.NONE));
            }
        }
    }

    private static double requireThreshold(Double threshold) {
        if (threshold == null || threshold.isNaN()) throw new InvalidRuleException("threshold is required for this preset");
        return threshold;
    }

    private static String format(double v) {
        return v == Math.rint(v) ? String.valueOf((long) v) : String.valueOf(v);
    }
}
