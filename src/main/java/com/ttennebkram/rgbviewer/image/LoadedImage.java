package com.ttennebkram.rgbviewer.image;

import org.opencv.core.Mat;

import java.nio.file.Path;

/**
 * A decoded image and what the info line shows about it.
 * The Mat is 8-bit, BGR(A) or grayscale, and owned by this object until {@link #release()}.
 */
public class LoadedImage {

    public final Path path;
    public final String format;
    public final Mat mat;

    public LoadedImage(Path path, String format, Mat mat) {
        this.path = path;
        this.format = format;
        this.mat = mat;
    }

    public String getName() {
        return path.getFileName().toString();
    }

    public int getWidth() {
        return mat.cols();
    }

    public int getHeight() {
        return mat.rows();
    }

    public int getChannels() {
        return mat.channels();
    }

    public void release() {
        mat.release();
    }

    /**
     * Text for the info line under the image, e.g. "Size: 640×480 pixels | Format: PNG".
     */
    public String describe() {
        return "Size: " + getWidth() + "×" + getHeight() + " pixels | Format: " + format;
    }
}
