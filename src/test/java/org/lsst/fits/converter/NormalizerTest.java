package org.lsst.fits.converter;

import java.nio.ByteBuffer;
import java.nio.DoubleBuffer;
import java.nio.FloatBuffer;
import java.nio.IntBuffer;
import java.nio.ShortBuffer;
import java.util.Arrays;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import org.junit.Test;
import org.lsst.fits.converter.ConversionException.Failure;

/**
 *
 * @author tonyj
 */
public class NormalizerTest {

    private final Normalizer normalizer = new Normalizer();

    @Test
    public void testConstantArrayIsAllZero() throws ConversionException {
        int[] data = new int[100];
        Arrays.fill(data, 42);
        DisplayImage image = normalizer.normalize(new RawData<>(IntBuffer.wrap(data), new int[]{10, 10}, 32, 1, 0));
        assertEquals(10, image.getWidth());
        assertEquals(10, image.getHeight());
        assertEquals(1, image.getChannels());
        assertArrayEquals(new byte[100], image.getSamples());
    }

    @Test
    public void testStretchCoversFullRange() throws ConversionException {
        float[] data = new float[16];
        for (int i = 0; i < data.length; i++) {
            data[i] = 10.0f + i * 10.0f / 15;
        }
        DisplayImage image = normalizer.normalize(new RawData<>(FloatBuffer.wrap(data), new int[]{4, 4}, -32, 1, 0));
        assertEquals(0, image.getMinSample());
        assertEquals(255, image.getMaxSample());
        assertEquals(0, image.getSample(0, 0, 0));
        assertEquals(255, image.getSample(3, 3, 0));
    }

    @Test
    public void testNegativeValuesAndTruncation() throws ConversionException {
        double[] data = {-100, -50, 0, 100};
        DisplayImage image = normalizer.normalize(new RawData<>(DoubleBuffer.wrap(data), new int[]{1, 4}, -64, 1, 0));
        // 50 * 255 / 200 = 63.75, 100 * 255 / 200 = 127.5
        assertArrayEquals(new byte[]{0, 63, 127, (byte) 255}, image.getSamples());
    }

    @Test
    public void testMaximumAlwaysReaches255() throws ConversionException {
        double[][] ranges = {
            {0, 10, 20, 89.37815132123983},
            {0.1, 0.2, 0.3, 0.7},
            {-3.3, 1e-3, 2, 17.17},
            {1e-9, 2e-9, 3e-9, 7.77e-9}
        };
        for (double[] data : ranges) {
            DisplayImage image = normalizer.normalize(new RawData<>(DoubleBuffer.wrap(data), new int[]{2, 2}, -64, 1, 0));
            assertEquals(Arrays.toString(data), 0, image.getMinSample());
            assertEquals(Arrays.toString(data), 255, image.getMaxSample());
            assertEquals(Arrays.toString(data), 255, image.getSample(1, 1, 0));
        }
    }

    @Test
    public void testRangeWiderThanDoubleMax() throws ConversionException {
        double[] data = {-1e308, 0, 1e308, 5e307};
        DisplayImage image = normalizer.normalize(new RawData<>(DoubleBuffer.wrap(data), new int[]{2, 2}, -64, 1, 0));
        assertArrayEquals(new byte[]{0, 127, (byte) 255, (byte) 191}, image.getSamples());
    }

    @Test
    public void testIdempotent() throws ConversionException {
        byte[] data = new byte[256];
        for (int i = 0; i < data.length; i++) {
            data[i] = (byte) ((i * 37) % 256);
        }
        DisplayImage once = normalizer.normalize(new RawData<>(ByteBuffer.wrap(data), new int[]{16, 16}, 8, 1, 0));
        assertArrayEquals(data, once.getSamples());
        DisplayImage twice = normalizer.normalize(new RawData<>(ByteBuffer.wrap(once.getSamples()), new int[]{16, 16}, 8, 1, 0));
        assertEquals(once, twice);
    }

    @Test
    public void testNaNIgnored() throws ConversionException {
        float[] data = {Float.NaN, 1, 3, Float.POSITIVE_INFINITY};
        DisplayImage image = normalizer.normalize(new RawData<>(FloatBuffer.wrap(data), new int[]{2, 2}, -32, 1, 0));
        assertArrayEquals(new byte[]{0, 0, (byte) 255, 0}, image.getSamples());
    }

    @Test
    public void testAllNaNIsAllZero() throws ConversionException {
        float[] data = {Float.NaN, Float.NaN, Float.NaN, Float.NaN};
        DisplayImage image = normalizer.normalize(new RawData<>(FloatBuffer.wrap(data), new int[]{2, 2}, -32, 1, 0));
        assertArrayEquals(new byte[4], image.getSamples());
    }

    @Test
    public void testThreeDimensionsGiveChannels() throws ConversionException {
        short[] data = new short[2 * 3 * 4];
        for (int i = 0; i < data.length; i++) {
            data[i] = (short) i;
        }
        DisplayImage image = normalizer.normalize(new RawData<>(ShortBuffer.wrap(data), new int[]{2, 3, 4}, 16, 1, 0));
        assertEquals(3, image.getWidth());
        assertEquals(2, image.getHeight());
        assertEquals(4, image.getChannels());
        assertEquals(255, image.getSample(2, 1, 3));
    }

    @Test
    public void testUnusualChannelCountPassesThrough() throws ConversionException {
        DisplayImage image = normalizer.normalize(new RawData<>(ShortBuffer.wrap(new short[2 * 2 * 7]), new int[]{2, 2, 7}, 16, 1, 0));
        assertEquals(7, image.getChannels());
    }

    @Test
    public void testUnsupportedDimensionality() {
        assertUnsupported(new int[]{8});
        assertUnsupported(new int[]{2, 2, 2, 1});
        assertUnsupported(new int[]{1, 1, 2, 2, 2});
    }

    @Test
    public void testCoerceTruncatesThenClips() throws ConversionException {
        double[] data = {-3.7, 12.9, 300, Double.NaN, 255, 0.2};
        DisplayImage image = normalizer.coerce(new RawData<>(DoubleBuffer.wrap(data), new int[]{2, 3}, -64, 1, 0));
        assertArrayEquals(new byte[]{0, 12, (byte) 255, 0, (byte) 255, 0}, image.getSamples());
    }

    @Test
    public void testCoercePassesBytesThrough() throws ConversionException {
        byte[] data = {0, 1, (byte) 128, (byte) 255};
        DisplayImage image = normalizer.coerce(new RawData<>(ByteBuffer.wrap(data), new int[]{2, 2}, 8, 1, 0));
        assertArrayEquals(data, image.getSamples());
    }

    @Test
    public void testCoerceAppliesScaling() throws ConversionException {
        short[] data = {-32768, -32768 + 100, -32768 + 1000};
        DisplayImage image = normalizer.coerce(new RawData<>(ShortBuffer.wrap(data), new int[]{1, 3}, 16, 1, 32768));
        assertArrayEquals(new byte[]{0, 100, (byte) 255}, image.getSamples());
    }

    private void assertUnsupported(int[] shape) {
        int size = 1;
        for (int n : shape) {
            size *= n;
        }
        RawData<IntBuffer> raw = new RawData<>(IntBuffer.wrap(new int[size]), shape, 32, 1, 0);
        for (boolean normalise : new boolean[]{true, false}) {
            try {
                DisplayImage image = normalise ? normalizer.normalize(raw) : normalizer.coerce(raw);
                fail("should not reach here: " + image);
            } catch (ConversionException x) {
                assertEquals(Failure.UNSUPPORTED_DIMENSIONALITY, x.getFailure());
                assertTrue(x.getMessage().contains(String.valueOf(shape.length)));
            }
        }
    }
}
