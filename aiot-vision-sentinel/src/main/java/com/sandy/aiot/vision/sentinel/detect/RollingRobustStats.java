package com.sandy.aiot.vision.sentinel.detect;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;

/**
 * Centered, time-based rolling median / MAD over an ordered series.
 * For the point at {@code t} the window holds every point with timestamp in {@code [t - W/2, t + W/2]}.
 * A zero MAD leaves sigma at 0 and the z-score at NaN.
 */
public final class RollingRobustStats {

    /** Scales MAD to a normal-consistent standard deviation. */
    public static final double MAD_SCALE = 1.4826;

    private final double[] median;
    private final double[] sigma;
    private final double[] zScore;

    private RollingRobustStats(double[] median, double[] sigma, double[] zScore) {
        this.median = median;
        this.sigma = sigma;
        this.zScore = zScore;
    }

    /**
     * @param timestamps ascending timestamps, same length as {@code values}
     */
    public static RollingRobustStats compute(List<LocalDateTime> timestamps, double[] values, Duration window) {
        int n = values.length;
        if (timestamps.size() != n) {
            throw new IllegalArgumentException("timestamps/values length mismatch: " + timestamps.size() + " vs " + n);
        }
        long halfMs = window.toMillis() / 2;
        long[] epoch = new long[n];
        for (int i = 0; i < n; i++) {
            epoch[i] = timestamps.get(i).toInstant(ZoneOffset.UTC).toEpochMilli();
        }
        double[] med = new double[n];
        double[] sig = new double[n];
        double[] z = new double[n];
        int lo = 0;
        int hi = 0;
        for (int i = 0; i < n; i++) {
            while (epoch[lo] < epoch[i] - halfMs) lo++;
            if (hi < i) hi = i;
            while (hi + 1 < n && epoch[hi + 1] <= epoch[i] + halfMs) hi++;
            double[] win = Arrays.copyOfRange(values, lo, hi + 1);
            double m = median(win);
            for (int j = 0; j < win.length; j++) {
                win[j] = Math.abs(win[j] - m);
            }
            double s = MAD_SCALE * median(win);
            med[i] = m;
            sig[i] = s;
            z[i] = s > 0 ? (values[i] - m) / s : Double.NaN;
        }
        return new RollingRobustStats(med, sig, z);
    }

    /** Median of the array; sorts it in place. Mean of the two middle values for even sizes. */
    static double median(double[] a) {
        if (a.length == 0) return Double.NaN;
        Arrays.sort(a);
        int mid = a.length / 2;
        return a.length % 2 == 1 ? a[mid] : (a[mid - 1] + a[mid]) / 2.0;
    }

    public double median(int i) { return median[i]; }

    public double sigma(int i) { return sigma[i]; }

    public double zScore(int i) { return zScore[i]; }

    public int size() { return zScore.length; }
}
