package com.lucidchart.pixeldiff;

import java.awt.Color;

/** Perceptual colour difference between two RGBA pixels, and the pixel painters used to render a diff image.
 *
 * The metric follows "Measuring perceived colour difference using YIQ NTSC transmission colour space in mobile applications"
 * by Y. Kotsarenko and F. Ramos.  The result is a squared YIQ distance, signed so that callers can tell a pixel that got
 * darker from one that got brighter without a second flag.
 *
 * Every multiplication below is evaluated in the order written.  Reference diff images depend on the exact rounding, so
 * do not regroup terms or replace them with Math.fma.
 */
public final class ColorDelta {

    /** The largest value the squared YIQ distance can take.  Thresholds in [0,1] are scaled against it. */
    public static final double MAX_YIQ_DELTA = 35215.0;

    // Luminance (Y), in-phase (I) and quadrature (Q) weights of the NTSC transmission space
    static final double Y_R = 0.29889531;
    static final double Y_G = 0.58662247;
    static final double Y_B = 0.11448223;
    static final double I_R = 0.59597799;
    static final double I_G = 0.27417610;
    static final double I_B = 0.32180189;
    static final double Q_R = 0.21147017;
    static final double Q_G = 0.52261711;
    static final double Q_B = 0.31114694;

    // Relative weight of each YIQ component in the perceived distance
    private static final double Y_WEIGHT = 0.5053;
    private static final double I_WEIGHT = 0.299;
    private static final double Q_WEIGHT = 0.1957;

    /** Semi transparent pixels are blended over a dithered background of these two levels */
    private static final double BACKGROUND_DARK = 48.0;
    private static final double BACKGROUND_SPAN = 159.0;
    private static final double GOLDEN_RATIO = 1.618033988749895;
    private static final double GOLDEN_RATIO_SQUARED = 2.618033988749895;

    private ColorDelta() {}

    /** Returns the signed perceptual difference between the pixel at byte offset k of img1 and the pixel at byte offset m of img2.
     *
     * @param yOnly when true, only the signed luminance difference is returned
     * @return 0.0 when all four channels are equal.  Otherwise the squared YIQ distance, negated if the first pixel is the brighter one.
     * @throws IndexOutOfBoundsException if either offset does not address a whole pixel of its buffer
     */
    public static double colorDelta(byte[] img1, byte[] img2, int k, int m, boolean yOnly) {
        checkPixelOffset(img1, k);
        checkPixelOffset(img2, m);
        return delta(img1, img2, k, m, yOnly);
    }

    /** Unchecked variant for the comparison loops, whose row and column bounds already keep offsets inside the buffers. */
    static double delta(byte[] img1, byte[] img2, int k, int m, boolean yOnly) {
        double r1 = img1[k] & 0xFF;
        double g1 = img1[k + 1] & 0xFF;
        double b1 = img1[k + 2] & 0xFF;
        double a1 = img1[k + 3] & 0xFF;
        double r2 = img2[m] & 0xFF;
        double g2 = img2[m + 1] & 0xFF;
        double b2 = img2[m + 2] & 0xFF;
        double a2 = img2[m + 3] & 0xFF;

        double dr = r1 - r2;
        double dg = g1 - g2;
        double db = b1 - b2;
        double da = a1 - a2;

        if (dr == 0.0 && dg == 0.0 && db == 0.0 && da == 0.0) return 0.0;

        if (a1 < 255.0 || a2 < 255.0) {
            // The background is keyed on the byte offset, not on x/y, so that it dithers instead of banding
            double rb = BACKGROUND_DARK + BACKGROUND_SPAN * (k % 2);
            double gb = BACKGROUND_DARK + BACKGROUND_SPAN * (((long) (k / GOLDEN_RATIO)) % 2);
            double bb = BACKGROUND_DARK + BACKGROUND_SPAN * (((long) (k / GOLDEN_RATIO_SQUARED)) % 2);
            dr = (r1 * a1 - r2 * a2 - rb * da) / 255.0;
            dg = (g1 * a1 - g2 * a2 - gb * da) / 255.0;
            db = (b1 * a1 - b2 * a2 - bb * da) / 255.0;
        }

        double y = dr * Y_R + dg * Y_G + db * Y_B;

        if (yOnly) return y;

        double i = dr * I_R - dg * I_G - db * I_B;
        double q = dr * Q_R - dg * Q_G + db * Q_B;

        double delta = Y_WEIGHT * y * y + I_WEIGHT * i * i + Q_WEIGHT * q * q;

        return y > 0.0 ? -delta : delta;
    }

    /** Paints an opaque pixel of the given colour at byte offset pos.  The alpha of the colour is ignored. */
    static void drawPixel(byte[] output, int pos, Color color) {
        output[pos] = (byte) color.getRed();
        output[pos + 1] = (byte) color.getGreen();
        output[pos + 2] = (byte) color.getBlue();
        output[pos + 3] = (byte) 255;
    }

    /** Paints the luminance of the source pixel at srcPos, faded toward white, as an opaque gray pixel at dstPos.
     * The source alpha scales the fade, so a fully transparent pixel renders white.
     */
    static void drawGrayPixel(byte[] img, int srcPos, double alpha, byte[] output, int dstPos) {
        double r = img[srcPos] & 0xFF;
        double g = img[srcPos + 1] & 0xFF;
        double b = img[srcPos + 2] & 0xFF;
        double a = img[srcPos + 3] & 0xFF;
        double val = 255.0 + (r * Y_R + g * Y_G + b * Y_B - 255.0) * alpha * a / 255.0;
        byte gray = (byte) toChannel(val);
        output[dstPos] = gray;
        output[dstPos + 1] = gray;
        output[dstPos + 2] = gray;
        output[dstPos + 3] = (byte) 255;
    }

    /** Truncates toward zero and saturates to the 0-255 channel range */
    private static int toChannel(double value) {
        int truncated = (int) value;
        return truncated < 0 ? 0 : Math.min(truncated, 255);
    }

    private static void checkPixelOffset(byte[] img, int offset) {
        if (img == null) throw new IllegalArgumentException("An image buffer must be provided");
        if (offset < 0 || offset > img.length - 4)
            throw new IndexOutOfBoundsException("Pixel offset " + offset + " is outside an image buffer of " + img.length + " bytes");
    }
}
