package com.lucidchart.pixeldiff;

/** Decides whether a differing pixel is likely an anti-aliasing artifact rather than a real change of content.
 *
 * Based on "Anti-aliased Pixel and Intensity Slope Detector" by V. Vysniauskas, 2009.  A pixel is considered anti-aliased
 * when its 3x3 neighbourhood contains both a darker and a brighter pixel, and one of the most extreme of those neighbours
 * sits in a flat region (it has at least three identical neighbours of its own).
 *
 * Two refinements over the paper's single pass:
 * every neighbour tied for the darkest or brightest delta is examined, not only the last one visited,
 * and the flat region may be found in either image, which keeps one pixel wide strokes and text from being reported.
 */
final class AntiAliasing {

    /** Neighbours in a 3x3 block, minus the centre */
    private static final int MAX_NEIGHBOURS = 8;

    private AntiAliasing() {}

    /**
     * @param img the image in which the centre pixel is examined
     * @param x1 column of the centre pixel
     * @param y1 row of the centre pixel
     * @param a first source image, searched for a flat region around the extreme neighbours
     * @param b second source image, searched likewise
     * @return true if the centre pixel of img looks like anti-aliasing
     */
    static boolean isAntiAliased(byte[] img, int x1, int y1, int width, int height, byte[] a, byte[] b) {
        int x0 = Math.max(x1 - 1, 0);
        int y0 = Math.max(y1 - 1, 0);
        int x2 = Math.min(x1 + 1, width - 1);
        int y2 = Math.min(y1 + 1, height - 1);
        int pos = (y1 * width + x1) * 4;

        // Pixels on the border have fewer neighbours; start them one equal neighbour up
        int zeroes = (x1 == x0 || x1 == x2 || y1 == y0 || y1 == y2) ? 1 : 0;
        double min = 0.0;
        double max = 0.0;

        double[] deltas = new double[MAX_NEIGHBOURS];
        int[] neighbourX = new int[MAX_NEIGHBOURS];
        int[] neighbourY = new int[MAX_NEIGHBOURS];
        int n = 0;

        // First pass: brightness slope towards every neighbour
        for (int x = x0; x <= x2; x++)
            for (int y = y0; y <= y2; y++) {
                if (x == x1 && y == y1) continue;

                double delta = ColorDelta.delta(img, img, pos, (y * width + x) * 4, true);
                deltas[n] = delta;
                neighbourX[n] = x;
                neighbourY[n] = y;
                n++;

                if (delta == 0.0) {
                    zeroes++;
                    // Too many identical neighbours to be an edge
                    if (zeroes > 2) return false;
                } else if (delta < min) {
                    min = delta;
                } else if (delta > max) {
                    max = delta;
                }
            }

        // Anti-aliasing needs both a darker and a brighter neighbour
        if (min == 0.0 || max == 0.0) return false;

        // Second pass: any neighbour at either extreme that sits in a flat region of either image
        for (int i = 0; i < n; i++) {
            if (deltas[i] == min || deltas[i] == max) {
                if (hasManySiblings(a, neighbourX[i], neighbourY[i], width, height) ||
                        hasManySiblings(b, neighbourX[i], neighbourY[i], width, height))
                    return true;
            }
        }
        return false;
    }

    /** True if the pixel has at least three neighbours of exactly the same RGBA value.  Border pixels need one fewer. */
    static boolean hasManySiblings(byte[] img, int x1, int y1, int width, int height) {
        int x0 = Math.max(x1 - 1, 0);
        int y0 = Math.max(y1 - 1, 0);
        int x2 = Math.min(x1 + 1, width - 1);
        int y2 = Math.min(y1 + 1, height - 1);
        int value = pixelWord(img, (y1 * width + x1) * 4);
        int zeroes = (x1 == x0 || x1 == x2 || y1 == y0 || y1 == y2) ? 1 : 0;

        for (int x = x0; x <= x2; x++)
            for (int y = y0; y <= y2; y++) {
                if (x == x1 && y == y1) continue;
                if (value == pixelWord(img, (y * width + x) * 4)) zeroes++;
                if (zeroes > 2) return true;
            }
        return false;
    }

    /** Packs the four channel bytes at pos into one int, for identity checks only.  The packing order is fixed (R lowest), so
     * two words are equal exactly when the pixels are. */
    static int pixelWord(byte[] img, int pos) {
        return (img[pos] & 0xFF)
                | (img[pos + 1] & 0xFF) << 8
                | (img[pos + 2] & 0xFF) << 16
                | (img[pos + 3] & 0xFF) << 24;
    }
}
