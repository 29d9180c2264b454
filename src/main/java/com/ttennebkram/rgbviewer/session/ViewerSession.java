package com.ttennebkram.rgbviewer.session;

import com.ttennebkram.rgbviewer.image.ImageLoader;
import com.ttennebkram.rgbviewer.image.LoadedImage;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Load-and-analyze operations on a {@link ViewerState}.
 * Each operation either returns a new state or throws, leaving the given state untouched.
 * Safe to call from a worker thread; holds no mutable state.
 */
public class ViewerSession {

    private final ImageLoader loader;

    public ViewerSession(ImageLoader loader) {
        this.loader = loader;
    }

    /**
     * Load the catalog image at the given index.
     */
    public ViewerState showIndex(ViewerState state, int index) throws IOException {
        Path path = state.getCatalog().get(index);
        AnalyzedImage analyzed = loadAndAnalyze(path);
        return new ViewerState(state.getCatalog(), index, analyzed);
    }

    /**
     * Advance to the next catalog image, wrapping around at the end.
     *
     * @throws IllegalStateException if the catalog is empty
     */
    public ViewerState next(ViewerState state) throws IOException {
        int nextIndex = state.getCatalog().nextIndex(state.getIndex());
        return showIndex(state, nextIndex);
    }

    /**
     * Show an image picked by the user. The catalog position is kept so "next"
     * continues from where the user was.
     */
    public ViewerState openCustom(ViewerState state, Path path) throws IOException {
        AnalyzedImage analyzed = loadAndAnalyze(path);
        return new ViewerState(state.getCatalog(), state.getIndex(), analyzed);
    }

    /**
     * First state of a session: the requested start file, else the first catalog image,
     * else nothing.
     */
    public ViewerState start(ViewerState state, Path startFile) throws IOException {
        if (startFile != null) {
            return openCustom(state, startFile);
        }
        if (!state.getCatalog().isEmpty()) {
            return showIndex(state, 0);
        }
        return state;
    }

    private AnalyzedImage loadAndAnalyze(Path path) throws IOException {
        LoadedImage image = loader.load(path);
        AnalyzedImage analyzed = AnalyzedImage.analyze(image);
        System.out.println("Loaded " + image.getName() + " (" + image.getWidth() + "x" + image.getHeight()
            + ", " + image.getChannels() + " ch): " + analyzed.counts);
        return analyzed;
    }

    /**
     * Release the previous image once a new state has replaced it.
     */
    public static void releaseReplaced(ViewerState previous, ViewerState next) {
        if (previous == null || previous.getCurrent() == null) {
            return;
        }
        if (next == null || previous.getCurrent() != next.getCurrent()) {
            previous.getCurrent().release();
        }
    }
}
