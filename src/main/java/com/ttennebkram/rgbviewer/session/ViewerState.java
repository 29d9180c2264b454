package com.ttennebkram.rgbviewer.session;

import com.ttennebkram.rgbviewer.analysis.ChannelCounts;
import com.ttennebkram.rgbviewer.image.ImageCatalog;

/**
 * What the viewer is showing: the catalog, the position in it and the current image.
 * Immutable; {@link ViewerSession} operations return a new state.
 */
public final class ViewerState {

    private final ImageCatalog catalog;
    private final int index;
    private final AnalyzedImage current;

    public ViewerState(ImageCatalog catalog, int index, AnalyzedImage current) {
        this.catalog = catalog;
        this.index = index;
        this.current = current;
    }

    /** State with nothing loaded yet. */
    public static ViewerState initial(ImageCatalog catalog) {
        return new ViewerState(catalog, 0, null);
    }

    public ImageCatalog getCatalog() {
        return catalog;
    }

    /** Position in the catalog that "next" advances from. */
    public int getIndex() {
        return index;
    }

    /** The displayed image, or null if none has loaded. */
    public AnalyzedImage getCurrent() {
        return current;
    }

    public boolean hasImage() {
        return current != null;
    }

    public ChannelCounts getCounts() {
        return current != null ? current.counts : ChannelCounts.EMPTY;
    }
}
