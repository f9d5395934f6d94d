package com.lucidchart.pixeldiff;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

/** Command line front end: compares two images and optionally writes the diff image as a PNG.
 *
 * Exit codes: 0 when no pixel differs, 1 when an image cannot be read, 64 for a usage error, 65 when the images differ in size,
 * 66 when differences were found.
 */
@Command(name = "pixeldiff", version = "1.0.0", mixinStandardHelpOptions = true, sortOptions = false,
        exitCodeOnInvalidInput = DiffCommand.EXIT_USAGE,
        description = "Compares two images pixel by pixel, ignoring anti-aliasing.")
public final class DiffCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(DiffCommand.class);

    static final int EXIT_MATCH = 0;
    static final int EXIT_UNREADABLE = 1;
    static final int EXIT_USAGE = 64;
    static final int EXIT_DIFFERENT_SIZE = 65;
    static final int EXIT_DIFFERENT = 66;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Parameters(index = "0", paramLabel = "IMAGE1", description = "The master image.")
    Path image1;
    @Parameters(index = "1", paramLabel = "IMAGE2", description = "The snapshot image to compare to the master.")
    Path image2;
    @Parameters(index = "2", paramLabel = "DIFF", arity = "0..1",
            description = "Optional destination of the rendered diff image (PNG).")
    Path diffOutput;

    @Option(names = "--threshold", paramLabel = "<0..1>", defaultValue = "0.1",
            description = "Matching threshold; smaller is more sensitive. Default: ${DEFAULT-VALUE}")
    double threshold;
    @Option(names = "--no-detect-anti-aliasing",
            description = "Count anti-aliased pixels as differences.  By default they are left out of the diff count.")
    boolean noDetectAntiAliasing;
    @Option(names = "--alpha", paramLabel = "<0..1>", defaultValue = "0.1",
            description = "Opacity of unchanged pixels in the diff image. Default: ${DEFAULT-VALUE}")
    double alpha;
    @Option(names = "--diff-mask", defaultValue = "false",
            description = "Draw only the differences, over a transparent background. Default: ${DEFAULT-VALUE}")
    boolean diffMask;
    @Option(names = "--parallelism", paramLabel = "<threads>",
            description = "Threads used to compare rows. Default: number of processors")
    Integer parallelism;

    public static void main(String[] args) {
        int execute = createCommandLine().execute(args);
        if (execute != 0) {
            System.exit(execute);
        }
    }

    static CommandLine createCommandLine() {
        return new CommandLine(new DiffCommand());
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        With options = options();

        RgbaImage master;
        RgbaImage snapshot;
        try {
            master = RgbaImage.read(image1);
            snapshot = RgbaImage.read(image2);
        } catch (UncheckedIOException | IllegalArgumentException e) {
            LOG.debug("Unable to read input images", e);
            PrintWriter err = spec.commandLine().getErr();
            err.println(e.getMessage());
            err.flush();
            return EXIT_UNREADABLE;
        }
        if (master.getWidth() != snapshot.getWidth() || master.getHeight() != snapshot.getHeight()) {
            out.printf("Image dimensions do not match: %dx%d vs %dx%d%n",
                    master.getWidth(), master.getHeight(), snapshot.getWidth(), snapshot.getHeight());
            out.flush();
            return EXIT_DIFFERENT_SIZE;
        }

        RgbaImage diff = diffOutput != null ? RgbaImage.blank(master.getWidth(), master.getHeight()) : null;

        long start = System.nanoTime();
        ComparisonResult result = ImageCompare.compare(master.getData(), snapshot.getData(), diff != null ? diff.getData() : null,
                master.getWidth(), master.getHeight(), options);
        LOG.info("Matched {} in {} ms", image2.getFileName(), TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));

        out.println("different pixels: " + result.getDiffCount());
        out.println("error: " + formatPercentage(result.getDiffPercentage()) + "%");
        if (result.getAaCount() > 0) {
            out.println("anti-aliased pixels: " + result.getAaCount());
        }
        out.flush();

        if (diff != null) {
            diff.write(diffOutput);
            LOG.debug("Wrote diff image to {}", diffOutput);
        }
        return result.getDiffCount() > 0 ? EXIT_DIFFERENT : EXIT_MATCH;
    }

    private With options() {
        try {
            With options = With.context()
                    .threshold(threshold)
                    .detectAntiAliasing(!noDetectAntiAliasing)
                    .alpha(alpha)
                    .diffMask(diffMask);
            if (parallelism != null) options.parallelism(parallelism);
            return options;
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
        }
    }

    /** The share of differing pixels as a percentage, rounded to two decimals */
    static String formatPercentage(double share) {
        double rounded = Math.round(share * 100 * 100) / 100.0;
        return rounded == Math.rint(rounded) ? Long.toString((long) rounded) : Double.toString(rounded);
    }
}
