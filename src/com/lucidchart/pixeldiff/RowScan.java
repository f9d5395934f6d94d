package com.lucidchart.pixeldiff;

import java.awt.Color;

/** The per pixel comparison of a band of rows.
 *
 * A scan only reads the two source images, and only writes the rows of the output it was asked to scan, so bands of the
 * same scan may run concurrently without locking.
 */
final class RowScan {

    /** Counts of one band.  Bands are combined by summing, in any order. */
    static final class Counts {
        final int diff;
        final int aa;

        Counts(int diff, int aa) {
            this.diff = diff;
            this.aa = aa;
        }

        Counts plus(Counts other) {
            return new Counts(diff + other.diff, aa + other.aa);
        }
    }

    static final Counts NONE = new Counts(0, 0);

    private final byte[] img1;
    private final byte[] img2;
    private final byte[] output;
    private final int width;
    private final int height;
    private final double maxDelta;
    private final boolean detectAntiAliasing;
    private final boolean diffMask;
    private final double alpha;
    private final Color aaColor;
    private final Color diffColor;
    private final Color diffColorAlt;

    /**
     * @param output the diff image to paint, or null to only count
     */
    RowScan(byte[] img1, byte[] img2, byte[] output, int width, int height, With options) {
        this.img1 = img1;
        this.img2 = img2;
        this.output = output;
        this.width = width;
        this.height = height;
        this.maxDelta = ColorDelta.MAX_YIQ_DELTA * options.getThreshold() * options.getThreshold();
        this.detectAntiAliasing = options.isDetectAntiAliasing();
        this.diffMask = options.isDiffMask();
        this.alpha = options.getAlpha();
        this.aaColor = options.getAaColor();
        this.diffColor = options.getDiffColor();
        this.diffColorAlt = options.getDiffColorAlt().orElse(options.getDiffColor());
    }

    /** Compares rows startRow (inclusive) to endRow (exclusive) */
    Counts scan(int startRow, int endRow) {
        int diff = 0;
        int aa = 0;
        for (int y = startRow; y < endRow; y++)
            for (int x = 0; x < width; x++) {
                int pos = (y * width + x) * 4;

                double delta = AntiAliasing.pixelWord(img1, pos) == AntiAliasing.pixelWord(img2, pos) ?
                        0.0 :
                        ColorDelta.delta(img1, img2, pos, pos, false);

                if (Math.abs(delta) > maxDelta) {
                    // Anti-aliased relative to either image is enough to excuse the pixel
                    boolean antiAliased = detectAntiAliasing &&
                            (AntiAliasing.isAntiAliased(img1, x, y, width, height, img1, img2) ||
                                    AntiAliasing.isAntiAliased(img2, x, y, width, height, img2, img1));
                    if (antiAliased) {
                        aa++;
                        if (output != null && !diffMask) ColorDelta.drawPixel(output, pos, aaColor);
                    } else {
                        diff++;
                        if (output != null) ColorDelta.drawPixel(output, pos, delta < 0.0 ? diffColorAlt : diffColor);
                    }
                } else if (output != null && !diffMask) {
                    ColorDelta.drawGrayPixel(img1, pos, alpha, output, pos);
                }
            }
        return new Counts(diff, aa);
    }
}
