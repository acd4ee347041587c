package org.lsst.fits.converter;

import java.nio.Buffer;
import java.nio.ByteBuffer;
import java.nio.DoubleBuffer;
import java.nio.FloatBuffer;
import java.nio.IntBuffer;
import java.nio.LongBuffer;
import java.nio.ShortBuffer;
import java.util.Arrays;

/**
 * Raw pixel data read from the primary HDU of a FITS file. The samples are
 * kept in the type they were stored with, the header scaling is applied when
 * values are read.
 *
 * @author tonyj
 * @param <T> The type of buffer holding the samples
 */
public class RawData<T extends Buffer> {

    private final T buffer;
    private final int[] shape;
    private final int bitpix;
    private final double bscale;
    private final double bzero;

    /**
     * Create raw data from a flattened pixel buffer
     *
     * @param buffer The samples, in row-major order
     * @param shape The array shape, slowest varying axis first
     * @param bitpix The FITS BITPIX of the samples
     * @param bscale The FITS BSCALE
     * @param bzero The FITS BZERO
     */
    RawData(T buffer, int[] shape, int bitpix, double bscale, double bzero) {
        long size = 1;
        for (int n : shape) {
            size *= n;
        }
        if (size != buffer.limit()) {
            throw new IllegalArgumentException("Buffer holds " + buffer.limit() + " samples, shape " + Arrays.toString(shape) + " needs " + size);
        }
        this.buffer = buffer;
        this.shape = shape.clone();
        this.bitpix = bitpix;
        this.bscale = bscale;
        this.bzero = bzero;
    }

    public T getBuffer() {
        return buffer;
    }

    public int[] getShape() {
        return shape.clone();
    }

    public int getNAxis() {
        return shape.length;
    }

    public int getBitpix() {
        return bitpix;
    }

    public int getSampleCount() {
        return buffer.limit();
    }

    boolean isScaled() {
        return bscale != 1.0 || bzero != 0.0;
    }

    /**
     * Get the physical value of one sample, with BSCALE and BZERO applied.
     * BITPIX=8 data is unsigned.
     *
     * @param index The index into the flattened array
     * @return The value
     */
    public double getValue(int index) {
        double raw;
        if (buffer instanceof ByteBuffer bBuffer) {
            raw = bBuffer.get(index) & 0xff;
        } else if (buffer instanceof ShortBuffer sBuffer) {
            raw = sBuffer.get(index);
        } else if (buffer instanceof IntBuffer iBuffer) {
            raw = iBuffer.get(index);
        } else if (buffer instanceof LongBuffer lBuffer) {
            raw = lBuffer.get(index);
        } else if (buffer instanceof FloatBuffer fBuffer) {
            raw = fBuffer.get(index);
        } else if (buffer instanceof DoubleBuffer dBuffer) {
            raw = dBuffer.get(index);
        } else {
            throw new IllegalStateException("Unsupported buffer type " + buffer.getClass().getName());
        }
        return isScaled() ? bzero + bscale * raw : raw;
    }

    @Override
    public String toString() {
        return "RawData{" + "shape=" + Arrays.toString(shape) + ", bitpix=" + bitpix + ", bscale=" + bscale + ", bzero=" + bzero + '}';
    }
}
