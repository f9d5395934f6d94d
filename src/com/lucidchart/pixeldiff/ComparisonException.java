package com.lucidchart.pixeldiff;

/** Raised when the buffers or dimensions handed to a comparison cannot describe the same image.
 * Detected before any pixel is read, and never dependent on pixel content.
 */
public class ComparisonException extends IllegalArgumentException {

    /** The closed set of input problems a comparison reports */
    public enum Kind {
        /** width * height * 4 does not fit a Java array */
        DIMENSION_OVERFLOW,
        /** A buffer's length is not width * height * 4 */
        BUFFER_LENGTH_MISMATCH,
        /** The two images have different sizes */
        IMAGE_SIZE_MISMATCH,
        /** The output buffer is not the size of the images */
        OUTPUT_SIZE_MISMATCH
    }

    private final Kind kind;
    private final long expected;
    private final long actual;

    private ComparisonException(Kind kind, long expected, long actual, String message) {
        super(message);
        this.kind = kind;
        this.expected = expected;
        this.actual = actual;
    }

    static ComparisonException dimensionOverflow(int width, int height) {
        return new ComparisonException(Kind.DIMENSION_OVERFLOW, Integer.MAX_VALUE, (long) width * height * 4,
                "Width * height overflows addressable memory (w" + width + ",h" + height + ")");
    }

    static ComparisonException bufferLengthMismatch(long expected, long actual) {
        return new ComparisonException(Kind.BUFFER_LENGTH_MISMATCH, expected, actual,
                "Image data size does not match width/height. Expecting " + expected + ". Got " + actual);
    }

    static ComparisonException imageSizeMismatch(long image1Size, long image2Size) {
        return new ComparisonException(Kind.IMAGE_SIZE_MISMATCH, image1Size, image2Size,
                "Image sizes do not match. Image 1 size: " + image1Size + ", image 2 size: " + image2Size);
    }

    static ComparisonException dimensionMismatch(int width1, int height1, int width2, int height2) {
        return new ComparisonException(Kind.IMAGE_SIZE_MISMATCH, (long) width1 * height1 * 4, (long) width2 * height2 * 4,
                "Image dimensions do not match: " + width1 + "x" + height1 + " vs " + width2 + "x" + height2);
    }

    static ComparisonException outputSizeMismatch(long imageSize, long outputSize) {
        return new ComparisonException(Kind.OUTPUT_SIZE_MISMATCH, imageSize, outputSize,
                "Output buffer size does not match image size. Image size: " + imageSize + ", output size: " + outputSize);
    }

    public Kind getKind() {
        return kind;
    }

    /** The size the comparison required */
    public long getExpected() {
        return expected;
    }

    /** The size it was given */
    public long getActual() {
        return actual;
    }
}
