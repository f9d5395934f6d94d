package com.lucidchart.pixeldiff;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/** A decoded image as a tightly packed RGBA buffer: 8 bits per channel, row major, no padding, width * height * 4 bytes.
 *
 * This is the form the comparison works on.  The buffer is shared, not copied, so a blank image can serve as the output of a
 * comparison; treat images read from disk as read only.
 */
public final class RgbaImage {
    private final byte[] data;
    private final int width;
    private final int height;

    private RgbaImage(byte[] data, int width, int height) {
        this.data = data;
        this.width = width;
        this.height = height;
    }

    /** Wraps an existing RGBA buffer */
    public static RgbaImage of(byte[] data, int width, int height) {
        require(data != null, "Image data must be provided");
        require(width >= 0 && height >= 0, "Image dimensions must not be negative");
        require((long) width * height * 4 == data.length,
                "Image data size does not match width/height. Expecting " + (long) width * height * 4 + ". Got " + data.length);
        return new RgbaImage(data, width, height);
    }

    /** A fully transparent black image, typically the output buffer of a comparison */
    public static RgbaImage blank(int width, int height) {
        require(width >= 0 && height >= 0, "Image dimensions must not be negative");
        require((long) width * height * 4 <= Integer.MAX_VALUE, "Image of (w" + width + ",h" + height + ") is too large");
        return new RgbaImage(new byte[width * height * 4], width, height);
    }

    /** Converts any buffered image to RGBA.  Colours are taken in sRGB, with straight (not premultiplied) alpha. */
    public static RgbaImage fromBufferedImage(BufferedImage image) {
        require(image != null, "An image must be provided");
        int width = image.getWidth();
        int height = image.getHeight();
        int[] argb = image.getRGB(0, 0, width, height, null, 0, width);
        byte[] data = new byte[argb.length * 4];
        for (int i = 0; i < argb.length; i++) {
            int pixel = argb[i];
            int pos = i * 4;
            data[pos] = (byte) (pixel >> 16);
            data[pos + 1] = (byte) (pixel >> 8);
            data[pos + 2] = (byte) pixel;
            data[pos + 3] = (byte) (pixel >>> 24);
        }
        return new RgbaImage(data, width, height);
    }

    /** Obtain an image from a path */
    public static RgbaImage read(Path image) {
        require(image != null, "An image path must be provided");
        return read(image.toFile());
    }

    /** Obtain an image from a file */
    public static RgbaImage read(File image) {
        require(image != null, "An image file must be provided");
        try {
            return decoded(ImageIO.read(image), image.getPath());
        } catch (IOException ioe) {
            throw new UncheckedIOException("Unable to obtain image from file " + image, ioe);
        }
    }

    /** Obtain an image from an array of encoded bytes, e.g. a PNG screenshot */
    public static RgbaImage read(byte[] encoded) {
        require(encoded != null, "Image bytes must be provided");
        try {
            return decoded(ImageIO.read(new ByteArrayInputStream(encoded)), "array of bytes");
        } catch (IOException ioe) {
            throw new UncheckedIOException("Unable to obtain image from array of bytes", ioe);
        }
    }

    /** Writes the image as a PNG, keeping the alpha channel */
    public void write(Path destination) {
        require(destination != null, "A destination must be provided");
        try {
            if (!ImageIO.write(toBufferedImage(), "png", destination.toFile()))
                throw new IllegalStateException("No PNG writer is available");
        } catch (IOException ioe) {
            throw new UncheckedIOException("Unable to write image to " + destination, ioe);
        }
    }

    /** Converts to a non-premultiplied ARGB buffered image */
    public BufferedImage toBufferedImage() {
        BufferedImage image = new BufferedImage(Math.max(width, 1), Math.max(height, 1), BufferedImage.TYPE_INT_ARGB);
        int[] argb = new int[width * height];
        for (int i = 0; i < argb.length; i++) {
            int pos = i * 4;
            argb[i] = (data[pos + 3] & 0xFF) << 24
                    | (data[pos] & 0xFF) << 16
                    | (data[pos + 1] & 0xFF) << 8
                    | (data[pos + 2] & 0xFF);
        }
        if (argb.length > 0) image.setRGB(0, 0, width, height, argb, 0, width);
        return image;
    }

    /** The backing RGBA buffer, not a copy */
    public byte[] getData() {
        return data;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    private static RgbaImage decoded(BufferedImage image, String source) {
        if (image == null) throw new IllegalArgumentException("Unsupported image format: " + source);
        return fromBufferedImage(image);
    }

    private static void require(boolean requirement, String message) {
        if (!requirement) throw new IllegalArgumentException(message);
    }

    @Override
    public String toString() {
        return "RgbaImage(w" + width + ",h" + height + ")";
    }
}
