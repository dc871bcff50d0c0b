package com.sandy.aiot.vision.sentinel.detect;

import com.sandy.aiot.vision.sentinel.entity.EventType;
import com.sandy.aiot.vision.sentinel.entity.Sample;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Classifies each point of a series as spike ({@code z > k}), sag ({@code z < -k}) or normal,
 * then keeps maximal runs of one class that are at least {@code minDurationPoints} long.
 */
public class AnomalyRunFinder {

    private final Duration window;
    private final double zThreshold;
    private final int minDurationPoints;

    public AnomalyRunFinder(Duration window, double zThreshold, int minDurationPoints) {
        if (window.isNegative() || window.isZero()) throw new IllegalArgumentException("window must be positive");
        if (zThreshold <= 0) throw new IllegalArgumentException("zThreshold must be positive");
        this.window = window;
        this.zThreshold = zThreshold;
        this.minDurationPoints = Math.max(1, minDurationPoints);
    }

    /**
     * @param samples one device/key series sorted by timestamp ascending
     */
    public List<AnomalyCandidate> find(List<Sample> samples) {
        int n = samples.size();
        if (n == 0) return List.of();
        List<LocalDateTime> ts = new ArrayList<>(n);
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            ts.add(samples.get(i).getTimestamp());
            values[i] = samples.get(i).getValue();
        }
        RollingRobustStats stats = RollingRobustStats.compute(ts, values, window);

        List<AnomalyCandidate> out = new ArrayList<>();
        EventType current = null;
        int runStart = -1;
        for (int i = 0; i <= n; i++) {
            EventType cls = i < n ? classify(stats.zScore(i)) : null;
            if (cls == current) continue;
            if (current != null) {
                int len = i - runStart;
                if (len >= minDurationPoints) {
                    out.add(toCandidate(current, runStart, i - 1, ts, values, stats));
                }
            }
            current = cls;
            runStart = i;
        }
        return out;
    }

    EventType classify(double z) {
        if (Double.isNaN(z)) return null;
        if (z > zThreshold) return EventType.SPIKE;
        if (z < -zThreshold) return EventType.SAG;
        return null;
    }

    private AnomalyCandidate toCandidate(EventType type, int from, int to, List<LocalDateTime> ts,
                                         double[] values, RollingRobustStats stats) {
        double peak = values[from];
        double zmax = 0;
        for (int i = from; i <= to; i++) {
            peak = type == EventType.SPIKE ? Math.max(peak, values[i]) : Math.min(peak, values[i]);
            zmax = Math.max(zmax, Math.abs(stats.zScore(i)));
        }
        return new AnomalyCandidate(type, ts.get(from), ts.get(to), to - from + 1, peak, zmax,
                stats.median(from), stats.sigma(from));
    }
}
