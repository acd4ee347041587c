package org.lsst.fits.converter.adjust;

import java.util.Arrays;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import org.junit.Test;
import org.lsst.fits.converter.DisplayImage;

/**
 *
 * @author tonyj
 */
public class ImageAdjusterTest {

    private final ImageAdjuster adjuster = new ImageAdjuster();

    private static DisplayImage gray(int width, int height, int... values) {
        byte[] data = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            data[i] = (byte) values[i];
        }
        return new DisplayImage(width, height, 1, data);
    }

    private static byte[] bytes(int... values) {
        byte[] data = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            data[i] = (byte) values[i];
        }
        return data;
    }

    @Test
    public void testIdentity() {
        DisplayImage image = gray(3, 2, 1, 2, 3, 4, 5, 6);
        DisplayImage result = adjuster.adjust(image, AdjustmentSettings.IDENTITY);
        assertSame(image, result);
        assertEquals(gray(3, 2, 1, 2, 3, 4, 5, 6), result);
    }

    @Test
    public void testBrightness() {
        DisplayImage image = gray(3, 1, 10, 100, 200);
        assertArrayEquals(bytes(20, 200, 255), adjuster.brightness(image, 2.0).getSamples());
        assertArrayEquals(bytes(5, 50, 100), adjuster.brightness(image, 0.5).getSamples());
    }

    @Test
    public void testContrastAroundMean() {
        DisplayImage image = gray(4, 1, 0, 100, 200, 100);
        assertArrayEquals(bytes(0, 100, 255, 100), adjuster.contrast(image, 2.0).getSamples());
        assertArrayEquals(bytes(50, 100, 150, 100), adjuster.contrast(image, 0.5).getSamples());
    }

    @Test
    public void testBrightnessBeforeContrast() {
        DisplayImage image = gray(4, 1, 0, 100, 200, 250);
        DisplayImage result = adjuster.adjust(image, new AdjustmentSettings(2.0, 2.0, 0));
        // Contrast first would give 0, 124, 255, 255
        assertArrayEquals(bytes(0, 222, 255, 255), result.getSamples());
    }

    @Test
    public void testAlphaPreserved() {
        DisplayImage image = new DisplayImage(2, 1, 2, bytes(100, 50, 200, 128));
        assertArrayEquals(bytes(200, 50, 255, 128), adjuster.brightness(image, 2.0).getSamples());
        DisplayImage rgba = new DisplayImage(1, 1, 4, bytes(10, 20, 30, 40));
        assertArrayEquals(bytes(5, 10, 15, 40), adjuster.brightness(rgba, 0.5).getSamples());
    }

    @Test
    public void testMeanLuminance() {
        assertEquals(15, ImageAdjuster.meanLuminance(gray(2, 1, 10, 20)));
        assertEquals(76, ImageAdjuster.meanLuminance(new DisplayImage(1, 1, 3, bytes(255, 0, 0))));
        assertEquals(255, ImageAdjuster.meanLuminance(new DisplayImage(1, 1, 3, bytes(255, 255, 255))));
    }

    @Test
    public void testRotate90() {
        DisplayImage image = gray(3, 2,
                1, 2, 3,
                4, 5, 6);
        DisplayImage rotated = adjuster.rotate(image, 90);
        assertEquals(gray(2, 3,
                3, 6,
                2, 5,
                1, 4), rotated);
    }

    @Test
    public void testRotate270() {
        DisplayImage image = gray(3, 2,
                1, 2, 3,
                4, 5, 6);
        assertEquals(gray(2, 3,
                4, 1,
                5, 2,
                6, 3), adjuster.rotate(image, 270));
        assertEquals(adjuster.rotate(image, 270), adjuster.rotate(image, -90));
    }

    @Test
    public void testTwoQuarterTurnsMakeAHalfTurn() {
        DisplayImage image = new DisplayImage(3, 2, 3, bytes(
                1, 2, 3, 4, 5, 6, 7, 8, 9,
                10, 11, 12, 13, 14, 15, 16, 17, 18));
        DisplayImage twice = adjuster.rotate(adjuster.rotate(image, 90), 90);
        DisplayImage once = adjuster.rotate(image, 180);
        assertEquals(once, twice);
        assertEquals(3, once.getWidth());
        assertEquals(16, once.getSample(0, 0, 0));
        assertEquals(18, once.getSample(0, 0, 2));
    }

    @Test
    public void testFullTurnIsNoOp() {
        DisplayImage image = gray(2, 2, 1, 2, 3, 4);
        assertSame(image, adjuster.rotate(image, 360));
        assertSame(image, adjuster.adjust(image, new AdjustmentSettings(1.0, 1.0, -720)));
        assertEquals(adjuster.rotate(image, 90), adjuster.rotate(image, 450));
    }

    @Test
    public void testRotateExpandsCanvas() {
        int[] values = new int[100];
        Arrays.fill(values, 200);
        DisplayImage rotated = adjuster.rotate(gray(10, 10, values), 45);
        // 10 * (cos 45 + sin 45) = 14.14
        assertEquals(15, rotated.getWidth());
        assertEquals(15, rotated.getHeight());
        assertEquals(200, rotated.getSample(7, 7, 0));
        assertEquals(0, rotated.getSample(0, 0, 0));
        assertEquals(0, rotated.getSample(14, 14, 0));
    }

    @Test
    public void testRotateSmallAngleKeepsContent() {
        DisplayImage rotated = adjuster.rotate(gray(20, 10, new int[200]), 10);
        // 20 cos 10 + 10 sin 10 = 21.43, 10 cos 10 + 20 sin 10 = 13.32
        assertEquals(22, rotated.getWidth());
        assertEquals(14, rotated.getHeight());
    }
}
