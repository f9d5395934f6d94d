package com.lucidchart.pixeldiff;

import org.testng.Assert;
import org.testng.annotations.Test;

import static com.lucidchart.pixeldiff.TestUtil.*;

public class AntiAliasingTest {

    @Test
    public void testGrayFringeNextToALine() {
        byte[] line = antiAliasedLine(8, 8, 3);
        Assert.assertTrue(AntiAliasing.isAntiAliased(line, 4, 3, 8, 8, line, line));
    }

    @Test
    public void testSolidLineIsNotAntiAliased() {
        byte[] line = verticalLine(8, 8, 3);
        // Five white neighbours
        Assert.assertFalse(AntiAliasing.isAntiAliased(line, 4, 3, 8, 8, line, line));
        // Every neighbour is at least as bright
        Assert.assertFalse(AntiAliasing.isAntiAliased(line, 3, 3, 8, 8, line, line));
    }

    @Test
    public void testFlatRegion() {
        byte[] white = fill(3, 3, WHITE);
        Assert.assertFalse(AntiAliasing.isAntiAliased(white, 1, 1, 3, 3, white, white));
        Assert.assertTrue(AntiAliasing.hasManySiblings(white, 1, 1, 3, 3));
        Assert.assertTrue(AntiAliasing.hasManySiblings(white, 0, 0, 3, 3));
    }

    @Test
    public void testEveryTiedNeighbourIsExamined() {
        // Only the last of the three darkest neighbours sits in a flat region
        byte[] img = tiedNeighbourhood(true);
        Assert.assertFalse(AntiAliasing.hasManySiblings(img, 1, 1, 5, 5));
        Assert.assertFalse(AntiAliasing.hasManySiblings(img, 1, 2, 5, 5));
        Assert.assertTrue(AntiAliasing.hasManySiblings(img, 1, 3, 5, 5));
        Assert.assertTrue(AntiAliasing.isAntiAliased(img, 2, 2, 5, 5, img, img));
    }

    @Test
    public void testNoFlatRegionAroundTheExtremes() {
        byte[] img = tiedNeighbourhood(false);
        for (int y = 1; y <= 3; y++) {
            Assert.assertFalse(AntiAliasing.hasManySiblings(img, 1, y, 5, 5));
            Assert.assertFalse(AntiAliasing.hasManySiblings(img, 3, y, 5, 5));
        }
        Assert.assertFalse(AntiAliasing.isAntiAliased(img, 2, 2, 5, 5, img, img));
    }

    @Test
    public void testFlatRegionMayBeInTheOtherImage() {
        byte[] examined = tiedNeighbourhood(false);
        byte[] other = tiedNeighbourhood(true);
        Assert.assertTrue(AntiAliasing.isAntiAliased(examined, 2, 2, 5, 5, examined, other));
        Assert.assertTrue(AntiAliasing.isAntiAliased(examined, 2, 2, 5, 5, other, examined));
    }

    @Test
    public void testSinglePixelImage() {
        byte[] img = fill(1, 1, GRAY);
        Assert.assertFalse(AntiAliasing.isAntiAliased(img, 0, 0, 1, 1, img, img));
        Assert.assertFalse(AntiAliasing.hasManySiblings(img, 0, 0, 1, 1));
    }

    @Test
    public void testSingleColumnAndSingleRow() {
        byte[] column = new byte[12];
        setPixel(column, 1, 0, 0, BLACK);
        setPixel(column, 1, 0, 1, GRAY);
        setPixel(column, 1, 0, 2, WHITE);
        Assert.assertFalse(AntiAliasing.isAntiAliased(column, 0, 1, 1, 3, column, column));

        byte[] row = new byte[12];
        setPixel(row, 3, 0, 0, BLACK);
        setPixel(row, 3, 1, 0, GRAY);
        setPixel(row, 3, 2, 0, WHITE);
        Assert.assertFalse(AntiAliasing.isAntiAliased(row, 1, 0, 3, 1, row, row));
    }

    @Test
    public void testPixelWordIdentity() {
        byte[] img = pixels(1, 2, 3, 4, 1, 2, 3, 4, 4, 3, 2, 1);
        Assert.assertEquals(AntiAliasing.pixelWord(img, 0), AntiAliasing.pixelWord(img, 4));
        Assert.assertNotEquals(AntiAliasing.pixelWord(img, 0), AntiAliasing.pixelWord(img, 8));
        Assert.assertEquals(AntiAliasing.pixelWord(pixels(255, 255, 255, 255), 0), -1);
    }
}
