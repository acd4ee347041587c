package org.lsst.fits.converter;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import java.awt.image.BufferedImage;
import java.io.File;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Renders previews of the first selected file under the current adjustment
 * settings. The decoded and normalized image is cached, so changing the
 * settings only repeats the adjustment step. A file modified since it was
 * cached is read again.
 *
 * @author tonyj
 */
public class PreviewRenderer {

    private static final Logger LOG = Logger.getLogger(PreviewRenderer.class.getName());

    private final FitsConverter converter;
    private final LoadingCache<PreviewKey, DisplayImage> preparedCache;

    public PreviewRenderer() {
        this(new FitsConverter());
    }

    public PreviewRenderer(FitsConverter converter) {
        this.converter = converter;
        preparedCache = Caffeine.newBuilder()
                .maximumSize(Integer.getInteger("org.lsst.fits.converter.previewCacheSize", 8))
                .recordStats()
                .build((PreviewKey key) -> {
                    return Timed.execute(() -> {
                        return converter.prepare(key.file, key.autoNormalise);
                    }, "Preparing preview of %s took %dms", key.file);
                });
    }

    /**
     * Preview the first file of a selection.
     *
     * @param selection The selected files, in selection order
     * @return The preview image
     * @throws ConversionException If the first file cannot be rendered
     */
    public BufferedImage preview(List<ConversionRequest> selection) throws ConversionException {
        if (selection.isEmpty()) {
            throw new IllegalArgumentException("Nothing selected to preview");
        }
        return preview(selection.get(0));
    }

    public BufferedImage preview(ConversionRequest request) throws ConversionException {
        File file = request.getSource().getAbsoluteFile();
        PreviewKey key = new PreviewKey(file, file.lastModified(), request.isAutoNormalise());
        DisplayImage prepared;
        try {
            prepared = preparedCache.get(key);
        } catch (CompletionException x) {
            Throwable cause = x.getCause();
            if (cause instanceof ConversionException) {
                throw (ConversionException) cause;
            } else {
                throw new ConversionException(ConversionException.Failure.UNREADABLE_CONTAINER, "Unexpected exception preparing preview of " + file, cause);
            }
        }
        DisplayImage adjusted = converter.getAdjuster().adjust(prepared, request.getSettings());
        return converter.getEncoder().toBufferedImage(adjusted);
    }

    public void invalidate() {
        preparedCache.invalidateAll();
    }

    long cachedCount() {
        preparedCache.cleanUp();
        return preparedCache.estimatedSize();
    }

    public void report() {
        LOG.log(Level.INFO, "preview Cache size {0} stats {1}", new Object[]{preparedCache.estimatedSize(), preparedCache.stats()});
    }

    private static class PreviewKey {

        private final File file;
        private final long lastModified;
        private final boolean autoNormalise;

        PreviewKey(File file, long lastModified, boolean autoNormalise) {
            this.file = file;
            this.lastModified = lastModified;
            this.autoNormalise = autoNormalise;
        }

        @Override
        public int hashCode() {
            int hash = 7;
            hash = 41 * hash + Objects.hashCode(this.file);
            hash = 41 * hash + (int) (this.lastModified ^ (this.lastModified >>> 32));
            hash = 41 * hash + (this.autoNormalise ? 1 : 0);
            return hash;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) {
                return true;
            }
            if (obj == null || getClass() != obj.getClass()) {
                return false;
            }
            final PreviewKey other = (PreviewKey) obj;
            return this.lastModified == other.lastModified
                    && this.autoNormalise == other.autoNormalise
                    && Objects.equals(this.file, other.file);
        }

        @Override
        public String toString() {
            return "PreviewKey{" + "file=" + file + ", autoNormalise=" + autoNormalise + '}';
        }
    }
}
