package com.lucidchart.pixeldiff;

import java.util.Objects;

/** The outcome of a pixel comparison.
 *
 * The counts never depend on whether a diff image was rendered.
 * {@link #isIdentical()} only reports byte equality of the two images; {@link #isMatch()} reports that no pixel was counted
 * as different, which also holds when a high threshold or anti-aliasing detection absorbed every change.
 */
public final class ComparisonResult {
    private final int diffCount;
    private final int aaCount;
    private final int totalPixels;
    private final boolean identical;

    ComparisonResult(int diffCount, int aaCount, int totalPixels, boolean identical) {
        this.diffCount = diffCount;
        this.aaCount = aaCount;
        this.totalPixels = totalPixels;
        this.identical = identical;
    }

    static ComparisonResult identical(int totalPixels) {
        return new ComparisonResult(0, 0, totalPixels, true);
    }

    /** Number of pixels counted as different */
    public int getDiffCount() {
        return diffCount;
    }

    /** Number of pixels above the threshold that were attributed to anti-aliasing */
    public int getAaCount() {
        return aaCount;
    }

    /** width * height */
    public int getTotalPixels() {
        return totalPixels;
    }

    /** Share of differing pixels, from 0 to 1.  0 for an empty image. */
    public double getDiffPercentage() {
        return totalPixels > 0 ? (double) diffCount / totalPixels : 0.0;
    }

    /** True only if the two images were byte for byte equal */
    public boolean isIdentical() {
        return identical;
    }

    /** True if no pixel was counted as different */
    public boolean isMatch() {
        return diffCount == 0;
    }

    public Status getStatus() {
        return Status.of(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ComparisonResult)) return false;
        ComparisonResult that = (ComparisonResult) o;
        return diffCount == that.diffCount &&
                aaCount == that.aaCount &&
                totalPixels == that.totalPixels &&
                identical == that.identical;
    }

    @Override
    public int hashCode() {
        return Objects.hash(diffCount, aaCount, totalPixels, identical);
    }

    @Override
    public String toString() {
        return "Pixel Comparison: " +
                "\n\nStatus = " + getStatus().text +
                "\nDifferent Pixels = " + diffCount +
                "\nAnti-aliased Pixels = " + aaCount +
                "\nTotal Pixels = " + totalPixels +
                "\nIdentical = " + identical;
    }
}
