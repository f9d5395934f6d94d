package com.lucidchart.pixeldiff;

import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static com.lucidchart.pixeldiff.TestUtil.*;

public class DiffCommandTest {

    private Path dir;
    private StringWriter out;
    private StringWriter err;

    @BeforeMethod
    public void setUp() throws IOException {
        dir = Files.createTempDirectory("pixeldiff");
        out = new StringWriter();
        err = new StringWriter();
    }

    private int run(String... args) {
        CommandLine commandLine = DiffCommand.createCommandLine();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }

    private String image(String name, byte[] data, int width, int height) {
        Path file = dir.resolve(name);
        RgbaImage.of(data, width, height).write(file);
        return file.toString();
    }

    @Test
    public void testMatchingImages() {
        String master = image("a.png", verticalLine(8, 8, 3), 8, 8);
        String snapshot = image("b.png", antiAliasedLine(8, 8, 3), 8, 8);
        Assert.assertEquals(run(master, snapshot), DiffCommand.EXIT_MATCH);
        Assert.assertEquals(out.toString(), String.format("different pixels: 0%nerror: 0%%%nanti-aliased pixels: 8%n"));
    }

    @Test
    public void testDifferentImages() {
        String master = image("a.png", fill(10, 10, WHITE), 10, 10);
        byte[] square = fill(10, 10, WHITE);
        for (int y = 4; y <= 6; y++)
            for (int x = 4; x <= 6; x++) setPixel(square, 10, x, y, RED);
        String snapshot = image("b.png", square, 10, 10);

        Assert.assertEquals(run(master, snapshot), DiffCommand.EXIT_DIFFERENT);
        Assert.assertEquals(out.toString(), String.format("different pixels: 9%nerror: 9%%%n"));
    }

    @Test
    public void testWritesDiffImage() {
        String master = image("a.png", fill(3, 3, WHITE), 3, 3);
        byte[] dotted = fill(3, 3, WHITE);
        setPixel(dotted, 3, 1, 1, BLACK);
        String snapshot = image("b.png", dotted, 3, 3);
        Path diff = dir.resolve("diff.png");

        Assert.assertEquals(run("--diff-mask", master, snapshot, diff.toString()), DiffCommand.EXIT_DIFFERENT);
        RgbaImage written = RgbaImage.read(diff);
        Assert.assertEquals(pixelAt(written.getData(), 3, 1, 1), RED);
        Assert.assertEquals(pixelAt(written.getData(), 3, 0, 0), new int[]{0, 0, 0, 0});
    }

    @Test
    public void testOptions() {
        String master = image("a.png", verticalLine(8, 8, 3), 8, 8);
        String snapshot = image("b.png", antiAliasedLine(8, 8, 3), 8, 8);
        Assert.assertEquals(run("--no-detect-anti-aliasing", "--threshold", "0.2", "--parallelism", "2", master, snapshot),
                DiffCommand.EXIT_DIFFERENT);
        Assert.assertTrue(out.toString().startsWith("different pixels: 8"));
        Assert.assertTrue(out.toString().contains("error: 12.5%"));
    }

    @Test
    public void testAntiAliasingFlag() {
        DiffCommand defaults = new DiffCommand();
        new CommandLine(defaults).parseArgs("a.png", "b.png");
        Assert.assertFalse(defaults.noDetectAntiAliasing);

        DiffCommand counted = new DiffCommand();
        new CommandLine(counted).parseArgs("--no-detect-anti-aliasing", "a.png", "b.png");
        Assert.assertTrue(counted.noDetectAntiAliasing);
    }

    @Test
    public void testAntiAliasingIsExcusedByDefault() {
        String master = image("a.png", verticalLine(8, 8, 3), 8, 8);
        String snapshot = image("b.png", antiAliasedLine(8, 8, 3), 8, 8);
        Assert.assertEquals(run("--threshold", "0.2", master, snapshot), DiffCommand.EXIT_MATCH);
        Assert.assertTrue(out.toString().contains("anti-aliased pixels: 8"));
    }

    @Test
    public void testMissingImage() {
        String master = image("a.png", fill(1, 1, WHITE), 1, 1);
        String missing = dir.resolve("missing.png").toString();
        Assert.assertEquals(run(master, missing), DiffCommand.EXIT_UNREADABLE);
        Assert.assertTrue(err.toString().contains("missing.png"));
        Assert.assertFalse(err.toString().contains("at com.lucidchart"));
    }

    @Test
    public void testUndecodableImage() throws IOException {
        String master = image("a.png", fill(1, 1, WHITE), 1, 1);
        Path text = Files.write(dir.resolve("notes.png"), "not an image".getBytes(StandardCharsets.UTF_8));
        Assert.assertEquals(run(master, text.toString()), DiffCommand.EXIT_UNREADABLE);
        Assert.assertTrue(err.toString().contains("Unsupported image format"));
    }

    @Test
    public void testDifferentSizes() {
        String master = image("a.png", fill(2, 3, WHITE), 2, 3);
        String snapshot = image("b.png", fill(3, 2, WHITE), 3, 2);
        Assert.assertEquals(run(master, snapshot), DiffCommand.EXIT_DIFFERENT_SIZE);
        Assert.assertTrue(out.toString().contains("Image dimensions do not match: 2x3 vs 3x2"));
    }

    @Test
    public void testMissingArguments() {
        Assert.assertEquals(run(), DiffCommand.EXIT_USAGE);
        Assert.assertTrue(err.toString().contains("IMAGE1"));
    }

    @Test
    public void testThresholdOutOfRange() {
        String master = image("a.png", fill(1, 1, WHITE), 1, 1);
        Assert.assertEquals(run("--threshold", "2", master, master), DiffCommand.EXIT_USAGE);
        Assert.assertTrue(err.toString().contains("Threshold must be between 0 and 1"));
    }

    @Test
    public void testFormatPercentage() {
        Assert.assertEquals(DiffCommand.formatPercentage(0.0), "0");
        Assert.assertEquals(DiffCommand.formatPercentage(0.09), "9");
        Assert.assertEquals(DiffCommand.formatPercentage(0.125), "12.5");
        Assert.assertEquals(DiffCommand.formatPercentage(1.0 / 3), "33.33");
        Assert.assertEquals(DiffCommand.formatPercentage(1.0), "100");
    }
}
