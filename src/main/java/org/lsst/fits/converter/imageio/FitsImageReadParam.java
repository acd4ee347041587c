package org.lsst.fits.converter.imageio;

import java.util.Objects;
import javax.imageio.ImageReadParam;
import org.lsst.fits.converter.adjust.AdjustmentSettings;

/**
 * Read parameters for {@link FitsImageReader}. By default the data is
 * normalized and not adjusted.
 *
 * @author tonyj
 */
public class FitsImageReadParam extends ImageReadParam {

    private boolean autoNormalise = true;
    private AdjustmentSettings adjustments = AdjustmentSettings.IDENTITY;

    public boolean isAutoNormalise() {
        return autoNormalise;
    }

    public void setAutoNormalise(boolean autoNormalise) {
        this.autoNormalise = autoNormalise;
    }

    public AdjustmentSettings getAdjustments() {
        return adjustments;
    }

    public void setAdjustments(AdjustmentSettings adjustments) {
        this.adjustments = Objects.requireNonNull(adjustments);
    }
}
