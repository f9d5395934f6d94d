package com.lucidchart.pixeldiff;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/** A utility to compare two images of the same size pixel by pixel, the way a person would perceive the difference.
 *
 * Each pixel pair is measured in the YIQ colour space (see {@link ColorDelta}).  Pixels whose distance exceeds the threshold
 * are either counted as different, or, when they look like anti-aliasing in either image (see {@link AntiAliasing}), counted
 * separately and excused.  A diff image can be rendered on request: unchanged pixels as a faded gray copy of the master,
 * anti-aliased pixels in one colour, and differences in another.
 *
 * The static {@link #compare(byte[], byte[], byte[], int, int, With)} works on raw RGBA buffers.  The apply factories wrap
 * decoded images, and keep the result and a lazily rendered diff image together.
 */
public class ImageCompare {

    private static final Logger LOG = LoggerFactory.getLogger(ImageCompare.class);

    /** A band is never smaller than this many rows, so tiny images are not split into more tasks than they are worth */
    private static final int MIN_ROWS_PER_BAND = 4;

    /** Bands per worker thread, to even out rows of unequal cost */
    private static final int BANDS_PER_WORKER = 4;

    private static final long WORKER_KEEP_ALIVE_SECONDS = 30;
    private static final Map<Integer, ExecutorService> WORKER_POOLS = new ConcurrentHashMap<>();
    private static final AtomicInteger WORKER_COUNTER = new AtomicInteger();

    public final RgbaImage master; // The master image
    public final RgbaImage snapshot; // The current test snapshot to compare to the master
    private final With options; // Detached from the caller's context, so the rendered diff agrees with the result
    private final ComparisonResult result;

    /** Holds the rendered diff, when and if created */
    private RgbaImage pixelDiff;

    private ImageCompare(RgbaImage master, RgbaImage snapshot, With options) {
        require(master != null && snapshot != null, "A master and a snapshot image must be provided");
        require(options != null, "Comparison options must be provided");
        if (master.getWidth() != snapshot.getWidth() || master.getHeight() != snapshot.getHeight())
            throw ComparisonException.dimensionMismatch(master.getWidth(), master.getHeight(), snapshot.getWidth(), snapshot.getHeight());

        this.master = master;
        this.snapshot = snapshot;
        this.options = options.copy();
        this.result = compare(master.getData(), snapshot.getData(), null, master.getWidth(), master.getHeight(), this.options);
    }


    /*
       ___          _                                 _   _               _
      / __\_ _  ___| |_ ___  _ __ _   _    /\/\   ___| |_| |__   ___   __| |___
     / _\/ _` |/ __| __/ _ \| '__| | | |  /    \ / _ \ __| '_ \ / _ \ / _` / __|
    / / | (_| | (__| || (_) | |  | |_| | / /\/\ \  __/ |_| | | | (_) | (_| \__ \
    \/   \__,_|\___|\__\___/|_|   \__, | \/    \/\___|\__|_| |_|\___/ \__,_|___/
                                  |___/
     */

    /** Compare two images using the default threshold and anti-aliasing detection */
    public static ImageCompare apply(RgbaImage master, RgbaImage snapshot) {
        return new ImageCompare(master, snapshot, With.context());
    }

    /** Compare two images with the given options */
    public static ImageCompare apply(RgbaImage master, RgbaImage snapshot, With options) {
        return new ImageCompare(master, snapshot, options);
    }

    /** Compare two images using a preset match level */
    public static ImageCompare apply(RgbaImage master, RgbaImage snapshot, MatchLevel matchLevel) {
        return new ImageCompare(master, snapshot, With.context().matchLevel(matchLevel));
    }

    public static ImageCompare apply(BufferedImage master, BufferedImage snapshot, With options) {
        return new ImageCompare(RgbaImage.fromBufferedImage(master), RgbaImage.fromBufferedImage(snapshot), options);
    }

    public static ImageCompare apply(Path master, Path snapshot, With options) {
        return new ImageCompare(RgbaImage.read(master), RgbaImage.read(snapshot), options);
    }


    /*
       ___       _     _ _              _   _ _ _ _   _
      / _ \_   _| |__ | (_) ___   /\ /\| |_(_) (_) |_(_) ___  ___
     / /_)/ | | | '_ \| | |/ __| / / \ \ __| | | | __| |/ _ \/ __|
    / ___/| |_| | |_) | | | (__  \ \_/ / |_| | | | |_| |  __/\__ \
    \/     \__,_|_.__/|_|_|\___|  \___/ \__|_|_|_|\__|_|\___||___/

     */

    public ComparisonResult getResult() {
        return result;
    }

    /** True if no pixel of the snapshot was counted as different from the master */
    public boolean isMatch() {
        return result.isMatch();
    }

    /** Obtain status of the comparison */
    public Status getStatus() {
        return result.getStatus();
    }

    /** Obtain the rendered diff.  Rendering happens on first request. */
    public RgbaImage getPixelDiff() {
        if (pixelDiff == null) {
            RgbaImage rendered = RgbaImage.blank(master.getWidth(), master.getHeight());
            compare(master.getData(), snapshot.getData(), rendered.getData(), master.getWidth(), master.getHeight(), options);
            pixelDiff = rendered;
        }
        return pixelDiff;
    }

    /** Obtain the rendered diff as an ARGB image, ready for ImageIO */
    public BufferedImage getPixelDiffImage() {
        return getPixelDiff().toBufferedImage();
    }

    /** Compare two RGBA buffers using the default options.  See {@link #compare(byte[], byte[], byte[], int, int, With)} */
    public static ComparisonResult compare(byte[] img1, byte[] img2, byte[] output, int width, int height) {
        return compare(img1, img2, output, width, height, With.context());
    }

    /** Compares two tightly packed RGBA images, pixel by pixel.
     *
     * @param img1 the master, width * height * 4 bytes
     * @param img2 the snapshot, the same size as img1
     * @param output receives the diff image when not null.  Must be the size of img1.  Untouched in diff mask mode, except for differing pixels.
     * @return the counts of different and anti-aliased pixels
     * @throws ComparisonException when the buffers do not match each other or the dimensions
     */
    public static ComparisonResult compare(byte[] img1, byte[] img2, byte[] output, int width, int height, With options) {
        require(img1 != null && img2 != null, "Both image buffers must be provided");
        require(options != null, "Comparison options must be provided");

        // Negative dimensions are what unsigned sizes above Integer.MAX_VALUE look like from the Java side
        long expectedBytes = (long) width * height * 4;
        if (width < 0 || height < 0 || expectedBytes > Integer.MAX_VALUE)
            throw ComparisonException.dimensionOverflow(width, height);
        if (img1.length != img2.length)
            throw ComparisonException.imageSizeMismatch(img1.length, img2.length);
        if (output != null && output.length != img1.length)
            throw ComparisonException.outputSizeMismatch(img1.length, output.length);
        if (img1.length != expectedBytes)
            throw ComparisonException.bufferLengthMismatch(expectedBytes, img1.length);

        int totalPixels = width * height;

        if (Arrays.equals(img1, img2)) {
            LOG.debug("Images of (w{},h{}) are byte identical, skipping pixel comparison", width, height);
            if (output != null && !options.isDiffMask()) {
                for (int pos = 0; pos < img1.length; pos += 4)
                    ColorDelta.drawGrayPixel(img1, pos, options.getAlpha(), output, pos);
            }
            return ComparisonResult.identical(totalPixels);
        }

        RowScan scan = new RowScan(img1, img2, output, width, height, options);
        RowScan.Counts counts = scanRows(scan, height, options.getParallelism());
        return new ComparisonResult(counts.diff, counts.aa, totalPixels, false);
    }

    /** Legacy entry point returning only the number of different pixels */
    public static int count(byte[] img1, byte[] img2, byte[] output, int width, int height, With options) {
        return compare(img1, img2, output, width, height, options).getDiffCount();
    }


    /*
      _____       _                        _         _   _ _ _ _   _
      \_   \_ __ | |_ ___ _ __ _ __   __ _| |  /\ /\| |_(_) (_) |_(_) ___  ___
       / /\/ '_ \| __/ _ \ '__| '_ \ / _` | | / / \ \ __| | | | __| |/ _ \/ __|
    /\/ /_ | | | | ||  __/ |  | | | | (_| | | \ \_/ / |_| | | | |_| |  __/\__ \
    \____/ |_| |_|\__\___|_|  |_| |_|\__,_|_|  \___/ \__|_|_|_|\__|_|\___||___/

     */

    /** Splits the rows into contiguous bands, scans them on the shared pool for this parallelism and sums the partial counts.
     * Sums are order independent, and every band paints only its own rows, so the outcome does not depend on the pool size.
     */
    private static RowScan.Counts scanRows(RowScan scan, int height, int parallelism) {
        int bands = bandCount(height, parallelism);
        if (parallelism == 1 || bands <= 1) return scan.scan(0, height);

        LOG.debug("Scanning {} rows in {} bands on up to {} threads", height, bands, Math.min(parallelism, bands));

        ExecutorService executor = workerPool(parallelism);
        List<Future<RowScan.Counts>> partials = new ArrayList<>(bands);
        try {
            for (int band = 0; band < bands; band++) {
                int startRow = (int) ((long) height * band / bands);
                int endRow = (int) ((long) height * (band + 1) / bands);
                partials.add(executor.submit(() -> scan.scan(startRow, endRow)));
            }

            RowScan.Counts total = RowScan.NONE;
            for (Future<RowScan.Counts> partial : partials)
                total = total.plus(partial.get());
            return total;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while comparing image rows", ie);
        } catch (ExecutionException ee) {
            Throwable cause = ee.getCause();
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            if (cause instanceof Error) throw (Error) cause;
            throw new IllegalStateException("Unable to compare image rows", cause);
        } finally {
            // No-op for completed bands; stops the rest of a failed or interrupted comparison
            for (Future<RowScan.Counts> partial : partials) partial.cancel(true);
        }
    }

    /** The pool shared by every comparison of this parallelism.  Created on first use; idle workers exit after a while. */
    static ExecutorService workerPool(int parallelism) {
        return WORKER_POOLS.computeIfAbsent(parallelism, threads -> {
            ThreadPoolExecutor pool = new ThreadPoolExecutor(threads, threads, WORKER_KEEP_ALIVE_SECONDS, TimeUnit.SECONDS,
                    new LinkedBlockingQueue<>(), ImageCompare::newWorker);
            pool.allowCoreThreadTimeOut(true);
            return pool;
        });
    }

    /** Enough bands to keep every worker busy, but none thinner than MIN_ROWS_PER_BAND */
    static int bandCount(int height, int parallelism) {
        long byHeight = ((long) height + MIN_ROWS_PER_BAND - 1) / MIN_ROWS_PER_BAND;
        long byWorkers = (long) parallelism * BANDS_PER_WORKER;
        return (int) Math.max(1, Math.min(byHeight, byWorkers));
    }

    private static Thread newWorker(Runnable runnable) {
        Thread thread = new Thread(runnable, "pixeldiff-worker-" + WORKER_COUNTER.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    }

    /** A scala-like argument check */
    private static void require(boolean requirement, String message) {
        if (!requirement) throw new IllegalArgumentException(message);
    }

    @Override
    public String toString() {
        return result +
                "\n\nImage Size = (w" + master.getWidth() + ",h" + master.getHeight() + ")" +
                "\nThreshold = " + options.getThreshold() +
                "\nDetect Anti-aliasing = " + options.isDetectAntiAliasing();
    }
}
