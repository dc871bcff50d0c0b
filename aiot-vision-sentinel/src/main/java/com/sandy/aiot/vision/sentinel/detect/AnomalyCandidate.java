package com.sandy.aiot.vision.sentinel.detect;

import com.sandy.aiot.vision.sentinel.entity.EventType;

import java.time.LocalDateTime;

/**
 * One surviving run of same-class anomalous points for a single series.
 */
public record AnomalyCandidate(EventType type,
                               LocalDateTime startTs,
                               LocalDateTime endTs,
                               int points,
                               double peakValue,
                               double zmax,
                               double baselineMu,
                               double baselineSigma) {

    /** clamp(round(zmax), 1, 5) */
    public int severity() {
        return severityOf(zmax);
    }

    public static int severityOf(double zmax) {
        long rounded = Math.round(zmax);
        return (int) Math.max(1, Math.min(5, rounded));
    }
}
