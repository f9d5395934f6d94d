package com.lucidchart.pixeldiff;

import java.awt.Color;
import java.util.Optional;

/** A flexible way of specifying arguments in chain for a pixel comparison.
 * This enables semantic comparison calls and flexible updates of arguments without needing to maintain so many overloads.
 *
 * <pre>
 *     With.context().threshold(0.05).diffColorAlt(Color.GREEN)
 * </pre>
 */
public class With {
    private double thresholdHolder = 0.1;
    private boolean detectAntiAliasingHolder = true;
    private double alphaHolder = 0.1;
    private Color aaColorHolder = new Color(255, 255, 0);
    private Color diffColorHolder = new Color(255, 0, 0);
    private Color diffColorAltHolder = null;
    private boolean diffMaskHolder = false;

    /** Worker threads used to scan rows.  1 scans on the calling thread. */
    private int parallelismHolder = Runtime.getRuntime().availableProcessors();

    private With(){}

    /** Provides a With object to enable easy chaining of context options */
    public static With context() {
        return new With();
    }

    /** Matching threshold from 0 to 1.  Smaller is more sensitive, 0 reports every changed pixel.  (Default is 0.1) */
    public With threshold(double threshold) {
        require(threshold >= 0.0 && threshold <= 1.0, "Threshold must be between 0 and 1, got " + threshold);
        thresholdHolder = threshold;
        return this;
    }

    /** Whether pixels that only differ because of anti-aliasing are kept out of the diff count.  (Default is true) */
    public With detectAntiAliasing(boolean detectAntiAliasing) {
        detectAntiAliasingHolder = detectAntiAliasing;
        return this;
    }

    /** The inverse of {@link #detectAntiAliasing(boolean)}: true counts anti-aliased pixels as differences. */
    public With includeAntiAliased(boolean includeAntiAliased) {
        return detectAntiAliasing(!includeAntiAliased);
    }

    /** Opacity of the unchanged pixels in the diff image, from 0 (white) to 1.  (Default is 0.1) */
    public With alpha(double alpha) {
        require(alpha >= 0.0 && alpha <= 1.0, "Alpha must be between 0 and 1, got " + alpha);
        alphaHolder = alpha;
        return this;
    }

    /** Colour of anti-aliased pixels in the diff image.  (Default is yellow) */
    public With aaColor(Color aaColor) {
        require(aaColor != null, "An anti-aliasing colour must be provided");
        aaColorHolder = aaColor;
        return this;
    }

    /** Colour of differing pixels in the diff image.  (Default is red) */
    public With diffColor(Color diffColor) {
        require(diffColor != null, "A diff colour must be provided");
        diffColorHolder = diffColor;
        return this;
    }

    /** Colour of differing pixels that are darker in the second image.  Unset, the regular diff colour is used. */
    public With diffColorAlt(Color diffColorAlt) {
        diffColorAltHolder = diffColorAlt;
        return this;
    }

    /** Draw only the differences, over a transparent background, leaving out the gray preview and anti-aliased pixels. */
    public With diffMask(boolean diffMask) {
        diffMaskHolder = diffMask;
        return this;
    }

    /** Specify the number of threads used to scan rows.  (Default is the number of available processors) */
    public With parallelism(int parallelism) {
        require(parallelism >= 1, "Parallelism must be greater than or equal to 1");
        parallelismHolder = parallelism;
        return this;
    }

    /** Specify a preset match level */
    public With matchLevel(MatchLevel matchLevel) {
        require(matchLevel != null, "A match level must be supplied");
        this.thresholdHolder = matchLevel.threshold;
        this.detectAntiAliasingHolder = matchLevel.detectAntiAliasing;
        return this;
    }

    /** A detached copy, so that later changes to this context do not reach a comparison already made with it */
    With copy() {
        With copy = new With();
        copy.thresholdHolder = thresholdHolder;
        copy.detectAntiAliasingHolder = detectAntiAliasingHolder;
        copy.alphaHolder = alphaHolder;
        copy.aaColorHolder = aaColorHolder;
        copy.diffColorHolder = diffColorHolder;
        copy.diffColorAltHolder = diffColorAltHolder;
        copy.diffMaskHolder = diffMaskHolder;
        copy.parallelismHolder = parallelismHolder;
        return copy;
    }

    public double getThreshold() {
        return thresholdHolder;
    }

    public boolean isDetectAntiAliasing() {
        return detectAntiAliasingHolder;
    }

    public double getAlpha() {
        return alphaHolder;
    }

    public Color getAaColor() {
        return aaColorHolder;
    }

    public Color getDiffColor() {
        return diffColorHolder;
    }

    public Optional<Color> getDiffColorAlt() {
        return Optional.ofNullable(diffColorAltHolder);
    }

    public boolean isDiffMask() {
        return diffMaskHolder;
    }

    public int getParallelism() {
        return parallelismHolder;
    }

    private static void require(boolean requirement, String message) {
        if (!requirement) throw new IllegalArgumentException(message);
    }
}
