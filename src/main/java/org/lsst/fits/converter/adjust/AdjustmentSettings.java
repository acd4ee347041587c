package org.lsst.fits.converter.adjust;

import java.util.Objects;

/**
 * Brightness, contrast and rotation to apply to a display image. Brightness
 * and contrast are multiplicative factors where 1.0 leaves the image alone,
 * rotation is in degrees counter-clockwise.
 *
 * @author tonyj
 */
public final class AdjustmentSettings {

    public static final AdjustmentSettings IDENTITY = new AdjustmentSettings(1.0, 1.0, 0.0);

    private final double brightness;
    private final double contrast;
    private final double rotationDegrees;

    public AdjustmentSettings(double brightness, double contrast, double rotationDegrees) {
        if (!(brightness > 0) || Double.isInfinite(brightness)) {
            throw new IllegalArgumentException("Brightness must be a positive number: " + brightness);
        }
        if (!(contrast > 0) || Double.isInfinite(contrast)) {
            throw new IllegalArgumentException("Contrast must be a positive number: " + contrast);
        }
        if (!Double.isFinite(rotationDegrees)) {
            throw new IllegalArgumentException("Invalid rotation: " + rotationDegrees);
        }
        this.brightness = brightness;
        this.contrast = contrast;
        this.rotationDegrees = rotationDegrees;
    }

    public double getBrightness() {
        return brightness;
    }

    public double getContrast() {
        return contrast;
    }

    public double getRotationDegrees() {
        return rotationDegrees;
    }

    public boolean isIdentity() {
        return brightness == 1.0 && contrast == 1.0 && ImageAdjuster.isNoRotation(rotationDegrees);
    }

    public AdjustmentSettings withBrightness(double brightness) {
        return new AdjustmentSettings(brightness, contrast, rotationDegrees);
    }

    public AdjustmentSettings withContrast(double contrast) {
        return new AdjustmentSettings(brightness, contrast, rotationDegrees);
    }

    public AdjustmentSettings withRotation(double rotationDegrees) {
        return new AdjustmentSettings(brightness, contrast, rotationDegrees);
    }

    @Override
    public String toString() {
        return "AdjustmentSettings{" + "brightness=" + brightness + ", contrast=" + contrast + ", rotationDegrees=" + rotationDegrees + '}';
    }

    @Override
    public int hashCode() {
        return Objects.hash(brightness, contrast, rotationDegrees);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final AdjustmentSettings other = (AdjustmentSettings) obj;
        return Double.compare(this.brightness, other.brightness) == 0
                && Double.compare(this.contrast, other.contrast) == 0
                && Double.compare(this.rotationDegrees, other.rotationDegrees) == 0;
    }
}
