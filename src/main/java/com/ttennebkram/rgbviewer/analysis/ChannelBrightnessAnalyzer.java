package com.ttennebkram.rgbviewer.analysis;

import org.opencv.core.Mat;

/**
 * Counts, per color channel, the samples brighter than {@link #THRESHOLD}.
 * <p>
 * Grayscale images count their single channel once for each of red, green and blue.
 * An alpha channel is ignored. Stateless and safe to call from any thread.
 */
public final class ChannelBrightnessAnalyzer {

    /** Samples strictly above this 8-bit value are counted as bright. */
    public static final int THRESHOLD = 128;

    private ChannelBrightnessAnalyzer() {
    }

    /**
     * @param image decoded pixels, or null for no image
     * @return the counts; {@link ChannelCounts#EMPTY} when image is null
     */
    public static ChannelCounts analyze(PixelBuffer image) {
        if (image == null) {
            return ChannelCounts.EMPTY;
        }

        byte[] samples = image.rawSamples();
        int channels = image.getChannels();
        long totalPixels = image.getPixelCount();

        if (channels == 1) {
            long bright = 0;
            for (byte s : samples) {
                if ((s & 0xFF) > THRESHOLD) bright++;
            }
            return new ChannelCounts(bright, bright, bright, totalPixels);
        }

        long red = 0;
        long green = 0;
        long blue = 0;
        for (int i = 0; i < samples.length; i += channels) {
            if ((samples[i] & 0xFF) > THRESHOLD) red++;
            if ((samples[i + 1] & 0xFF) > THRESHOLD) green++;
            if ((samples[i + 2] & 0xFF) > THRESHOLD) blue++;
        }
        return new ChannelCounts(red, green, blue, totalPixels);
    }

    /**
     * Analyze a decoded OpenCV image (BGR/BGRA channel order).
     *
     * @param mat the image, or null/empty for no image
     */
    public static ChannelCounts analyze(Mat mat) {
        return analyze(PixelBuffer.fromMat(mat));
    }
}
