package com.ttennebkram.rgbviewer.session;

import com.ttennebkram.rgbviewer.analysis.ChannelBrightnessAnalyzer;
import com.ttennebkram.rgbviewer.analysis.ChannelCounts;
import com.ttennebkram.rgbviewer.image.LoadedImage;

/**
 * A loaded image together with its brightness counts.
 */
public class AnalyzedImage {

    public final LoadedImage image;
    public final ChannelCounts counts;

    public AnalyzedImage(LoadedImage image, ChannelCounts counts) {
        this.image = image;
        this.counts = counts;
    }

    /**
     * Run the brightness tally on a freshly loaded image.
     * The image is released if analysis fails.
     */
    public static AnalyzedImage analyze(LoadedImage image) {
        try {
            return new AnalyzedImage(image, ChannelBrightnessAnalyzer.analyze(image.mat));
        } catch (RuntimeException e) {
            image.release();
            throw e;
        }
    }

    public void release() {
        image.release();
    }
}
