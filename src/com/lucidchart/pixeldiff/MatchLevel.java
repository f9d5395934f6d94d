package com.lucidchart.pixeldiff;

/**
 * Preset levels of pixel comparison.
 *
 * EXACT counts every changed pixel, anti-aliasing included.
 * STRICT ignores anti-aliasing and only the faintest colour shifts.
 * STANDARD is the default threshold.
 * TOLERANT accepts changes which are still visible, but barely so.
 */
public class MatchLevel {
    public static final MatchLevel EXACT = MatchLevel.apply(0.0, false);
    public static final MatchLevel STRICT = MatchLevel.apply(0.05, true);
    public static final MatchLevel STANDARD = MatchLevel.apply(0.1, true);
    public static final MatchLevel TOLERANT = MatchLevel.apply(0.2, true);

    public final double threshold;
    public final boolean detectAntiAliasing;

    private MatchLevel(double threshold, boolean detectAntiAliasing) {
        this.threshold = threshold;
        this.detectAntiAliasing = detectAntiAliasing;
    }

    public static MatchLevel apply(double threshold, boolean detectAntiAliasing) {
        if (!(threshold >= 0.0 && threshold <= 1.0))
            throw new IllegalArgumentException("Threshold must be between 0 and 1, got " + threshold);
        return new MatchLevel(threshold, detectAntiAliasing);
    }

    @Override
    public String toString() {
        return "MatchLevel(threshold=" + threshold + ", detectAntiAliasing=" + detectAntiAliasing + ")";
    }
}
