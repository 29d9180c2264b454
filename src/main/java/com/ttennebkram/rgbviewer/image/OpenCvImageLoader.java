package com.ttennebkram.rgbviewer.image;

import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Loads images with Imgcodecs.imread(), keeping grayscale and alpha as stored.
 * Formats OpenCV cannot decode (GIF on most builds) fall back to ImageIO.
 * The result is always 8-bit with 1, 3 or 4 channels.
 */
public class OpenCvImageLoader implements ImageLoader {

    @Override
    public LoadedImage load(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("File not found: " + path);
        }
        if (!Files.isRegularFile(path)) {
            throw new IOException("Not a file: " + path);
        }
        if (!Files.isReadable(path)) {
            throw new IOException("Permission denied: " + path);
        }

        String filename = path.toAbsolutePath().toString();
        Mat mat = Imgcodecs.imread(filename, Imgcodecs.IMREAD_UNCHANGED);
        if (!mat.empty() && !hasSupportedChannels(mat)) {
            // e.g. two-channel gray+alpha: let OpenCV expand it to BGR
            mat.release();
            mat = Imgcodecs.imread(filename, Imgcodecs.IMREAD_COLOR);
        }
        if (mat.empty()) {
            mat.release();
            mat = readWithImageIO(path);
        }

        if (mat.depth() != CvType.CV_8U) {
            Mat eightBit = new Mat();
            double scale = mat.depth() == CvType.CV_16U ? 1.0 / 257.0 : 1.0;
            mat.convertTo(eightBit, CvType.CV_8U, scale);
            mat.release();
            mat = eightBit;
        }

        return new LoadedImage(path, formatName(path), mat);
    }

    private static boolean hasSupportedChannels(Mat mat) {
        int c = mat.channels();
        return c == 1 || c == 3 || c == 4;
    }

    private static Mat readWithImageIO(Path path) throws IOException {
        BufferedImage source = ImageIO.read(path.toFile());
        if (source == null) {
            throw new IOException("Unsupported or corrupt image: " + path.getFileName());
        }
        return bufferedImageToMat(source);
    }

    /**
     * Copy a BufferedImage into an 8-bit Mat in OpenCV channel order (gray, BGR or BGRA).
     */
    static Mat bufferedImageToMat(BufferedImage source) {
        int width = source.getWidth();
        int height = source.getHeight();

        if (source.getType() == BufferedImage.TYPE_BYTE_GRAY) {
            byte[] gray = ((DataBufferByte) source.getRaster().getDataBuffer()).getData();
            Mat mat = new Mat(height, width, CvType.CV_8UC1);
            mat.put(0, 0, gray);
            return mat;
        }

        boolean alpha = source.getColorModel().hasAlpha();
        int channels = alpha ? 4 : 3;
        int[] argb = source.getRGB(0, 0, width, height, null, 0, width);
        byte[] pixels = new byte[width * height * channels];
        int pos = 0;
        for (int p : argb) {
            pixels[pos++] = (byte) p;          // B
            pixels[pos++] = (byte) (p >> 8);   // G
            pixels[pos++] = (byte) (p >> 16);  // R
            if (alpha) {
                pixels[pos++] = (byte) (p >>> 24);
            }
        }
        Mat mat = new Mat(height, width, alpha ? CvType.CV_8UC4 : CvType.CV_8UC3);
        mat.put(0, 0, pixels);
        return mat;
    }

    /**
     * Format shown in the info line: upper-case extension, JPG reported as JPEG, N/A without one.
     */
    static String formatName(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return "N/A";
        }
        String ext = name.substring(dot + 1).toUpperCase(Locale.ROOT);
        return "JPG".equals(ext) ? "JPEG" : ext;
    }
}
