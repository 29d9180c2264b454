package com.ttennebkram.rgbviewer.analysis;

import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

/**
 * Immutable grid of unsigned 8-bit samples: H x W (grayscale), H x W x 3 (RGB)
 * or H x W x 4 (RGBA). Samples are interleaved row-major in R, G, B[, A] order.
 */
public final class PixelBuffer {

    private final int height;
    private final int width;
    private final int channels;
    private final byte[] samples;

    /**
     * Wrap already interleaved samples. The array is copied.
     *
     * @throws InvalidInputException if the shape is not (H, W, C) with C in {1, 3, 4}
     *         or the sample count does not match it
     */
    public PixelBuffer(int height, int width, int channels, byte[] samples) {
        if (height < 0 || width < 0) {
            throw new InvalidInputException("Negative dimensions: " + height + "x" + width);
        }
        checkChannels(channels);
        if (samples == null) {
            throw new InvalidInputException("Sample array is null");
        }
        long expected = (long) height * width * channels;
        if (samples.length != expected) {
            throw new InvalidInputException("Expected " + expected + " samples for "
                + height + "x" + width + "x" + channels + ", got " + samples.length);
        }
        this.height = height;
        this.width = width;
        this.channels = channels;
        this.samples = samples.clone();
    }

    private static void checkChannels(int channels) {
        if (channels != 1 && channels != 3 && channels != 4) {
            throw new InvalidInputException("Unsupported channel count: " + channels + " (expected 1, 3 or 4)");
        }
    }

    /**
     * Build a grayscale buffer from rows of 0-255 values.
     */
    public static PixelBuffer ofGray(int[][] rows) {
        if (rows == null) {
            throw new InvalidInputException("Rows are null");
        }
        int h = rows.length;
        int w = h > 0 ? rowLength(rows[0], 0) : 0;
        byte[] data = new byte[sampleCount(h, w, 1)];
        int pos = 0;
        for (int y = 0; y < h; y++) {
            if (rowLength(rows[y], y) != w) {
                throw new InvalidInputException("Ragged row " + y + ": expected width " + w);
            }
            for (int x = 0; x < w; x++) {
                data[pos++] = toSample(rows[y][x]);
            }
        }
        return new PixelBuffer(h, w, 1, data);
    }

    /**
     * Build an RGB or RGBA buffer from rows of pixels, each pixel an array of 0-255 samples.
     */
    public static PixelBuffer ofColor(int[][][] rows) {
        if (rows == null) {
            throw new InvalidInputException("Rows are null");
        }
        int h = rows.length;
        int w = h > 0 ? rowLength(rows[0], 0) : 0;
        int c = h > 0 && w > 0 ? pixelLength(rows[0][0], 0, 0) : 3;
        checkChannels(c);

        byte[] data = new byte[sampleCount(h, w, c)];
        int pos = 0;
        for (int y = 0; y < h; y++) {
            if (rowLength(rows[y], y) != w) {
                throw new InvalidInputException("Ragged row " + y + ": expected width " + w);
            }
            for (int x = 0; x < w; x++) {
                int[] pixel = rows[y][x];
                if (pixelLength(pixel, y, x) != c) {
                    throw new InvalidInputException("Pixel (" + y + ", " + x + ") has "
                        + pixel.length + " samples, expected " + c);
                }
                for (int i = 0; i < c; i++) {
                    data[pos++] = toSample(pixel[i]);
                }
            }
        }
        return new PixelBuffer(h, w, c, data);
    }

    /**
     * Number of samples for the shape, as an array length.
     *
     * @throws InvalidInputException if it does not fit in a Java array
     */
    static int sampleCount(long height, long width, int channels) {
        long count = height * width * channels;
        if (count > Integer.MAX_VALUE) {
            throw new InvalidInputException("Image too large: " + height + "x" + width + "x" + channels
                + " needs " + count + " samples");
        }
        return (int) count;
    }

    private static int rowLength(int[] row, int y) {
        if (row == null) {
            throw new InvalidInputException("Row " + y + " is null");
        }
        return row.length;
    }

    private static int rowLength(int[][] row, int y) {
        if (row == null) {
            throw new InvalidInputException("Row " + y + " is null");
        }
        return row.length;
    }

    private static int pixelLength(int[] pixel, int y, int x) {
        if (pixel == null) {
            throw new InvalidInputException("Pixel (" + y + ", " + x + ") is null");
        }
        return pixel.length;
    }

    private static byte toSample(int value) {
        if (value < 0 || value > 255) {
            throw new InvalidInputException("Sample out of 8-bit range: " + value);
        }
        return (byte) value;
    }

    /**
     * Copy a decoded OpenCV image into a buffer.
     * Converts BGR(A) to RGB(A) and scales 16-bit samples down to 8 bits.
     *
     * @param mat 2-D Mat with 1, 3 or 4 channels of depth CV_8U or CV_16U
     * @return the buffer, or null if mat is null or empty
     */
    public static PixelBuffer fromMat(Mat mat) {
        if (mat == null || mat.empty()) {
            return null;
        }
        if (mat.dims() != 2) {
            throw new InvalidInputException("Expected a 2-D image, got " + mat.dims() + " dimensions");
        }
        int channels = mat.channels();
        checkChannels(channels);

        sampleCount(mat.rows(), mat.cols(), channels);

        int depth = mat.depth();
        if (depth != CvType.CV_8U && depth != CvType.CV_16U) {
            throw new InvalidInputException("Unsupported sample depth: " + CvType.typeToString(mat.type()));
        }

        // Track temporary Mats for cleanup
        Mat eightBit = null;
        Mat rgb = null;
        try {
            Mat current = mat;
            if (depth == CvType.CV_16U) {
                eightBit = new Mat();
                current.convertTo(eightBit, CvType.CV_8U, 1.0 / 257.0);
                current = eightBit;
            }
            if (channels == 3) {
                rgb = new Mat();
                Imgproc.cvtColor(current, rgb, Imgproc.COLOR_BGR2RGB);
                current = rgb;
            } else if (channels == 4) {
                rgb = new Mat();
                Imgproc.cvtColor(current, rgb, Imgproc.COLOR_BGRA2RGBA);
                current = rgb;
            } else if (!current.isContinuous()) {
                rgb = current.clone();
                current = rgb;
            }

            byte[] data = new byte[sampleCount(current.rows(), current.cols(), channels)];
            current.get(0, 0, data);
            return new PixelBuffer(current.rows(), current.cols(), channels, data);
        } finally {
            if (eightBit != null) eightBit.release();
            if (rgb != null) rgb.release();
        }
    }

    public int getHeight() {
        return height;
    }

    public int getWidth() {
        return width;
    }

    public int getChannels() {
        return channels;
    }

    public long getPixelCount() {
        return (long) height * width;
    }

    /**
     * Unsigned sample value at (y, x) for channel index c.
     */
    public int sample(int y, int x, int c) {
        if (y < 0 || y >= height || x < 0 || x >= width) {
            throw new IndexOutOfBoundsException("Pixel (" + y + ", " + x + ") outside "
                + height + "x" + width);
        }
        if (c < 0 || c >= channels) {
            throw new IndexOutOfBoundsException("Channel " + c + " of " + channels);
        }
        return samples[(y * width + x) * channels + c] & 0xFF;
    }

    /** Package-private direct access for the analyzer; never mutated. */
    byte[] rawSamples() {
        return samples;
    }
}
