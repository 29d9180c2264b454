package com.ttennebkram.rgbviewer.fx;

import javafx.scene.image.Image;
import javafx.scene.image.PixelFormat;
import javafx.scene.image.PixelWriter;
import javafx.scene.image.WritableImage;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

/**
 * Utility methods for converting OpenCV Mats to JavaFX Images for display.
 */
public class FXImageUtils {

    /**
     * Convert an 8-bit OpenCV Mat (gray, BGR or BGRA) to a JavaFX Image.
     *
     * @param mat The OpenCV Mat to convert
     * @return A JavaFX Image, or null if conversion fails
     */
    public static Image matToImage(Mat mat) {
        if (mat == null || mat.empty()) {
            return null;
        }

        try {
            int width = mat.width();
            int height = mat.height();
            int channels = mat.channels();

            Mat converted;
            if (channels == 3) {
                converted = new Mat();
                Imgproc.cvtColor(mat, converted, Imgproc.COLOR_BGR2RGB);
            } else if (channels == 1) {
                converted = new Mat();
                Imgproc.cvtColor(mat, converted, Imgproc.COLOR_GRAY2RGB);
            } else if (channels == 4) {
                // JavaFX reads BGRA directly
                converted = mat.isContinuous() ? mat : mat.clone();
            } else {
                System.err.println("[FXImageUtils] Unsupported channel count: " + channels);
                return null;
            }

            int bufferSize = converted.channels() * width * height;
            byte[] buffer = new byte[bufferSize];
            converted.get(0, 0, buffer);

            WritableImage image = new WritableImage(width, height);
            PixelWriter pw = image.getPixelWriter();
            if (converted.channels() == 3) {
                pw.setPixels(0, 0, width, height,
                    PixelFormat.getByteRgbInstance(),
                    buffer, 0, width * 3);
            } else {
                pw.setPixels(0, 0, width, height,
                    PixelFormat.getByteBgraInstance(),
                    buffer, 0, width * 4);
            }

            if (converted != mat) {
                converted.release();
            }
            return image;

        } catch (Exception e) {
            System.err.println("[FXImageUtils] matToImage error: " + e.getMessage());
            e.printStackTrace();
            return null;
        }
    }

    /**
     * Convert an OpenCV Mat to a JavaFX Image that fits inside the given box,
     * keeping the aspect ratio. Images already smaller than the box are not enlarged.
     *
     * @param mat The OpenCV Mat to convert
     * @param maxWidth Maximum width for the output image
     * @param maxHeight Maximum height for the output image
     * @return A scaled JavaFX Image, or null if conversion fails
     */
    public static Image matToImage(Mat mat, int maxWidth, int maxHeight) {
        if (mat == null || mat.empty() || maxWidth <= 0 || maxHeight <= 0) {
            return null;
        }

        double scale = fitScale(mat.width(), mat.height(), maxWidth, maxHeight);
        if (scale >= 1.0) {
            return matToImage(mat);
        }

        // INTER_AREA for better quality when shrinking
        Mat scaled = new Mat();
        try {
            Size target = new Size(
                Math.max(1, Math.round(mat.width() * scale)),
                Math.max(1, Math.round(mat.height() * scale)));
            Imgproc.resize(mat, scaled, target, 0, 0, Imgproc.INTER_AREA);
            return matToImage(scaled);
        } finally {
            scaled.release();
        }
    }

    /**
     * Scale factor that fits width x height inside maxWidth x maxHeight.
     */
    public static double fitScale(int width, int height, int maxWidth, int maxHeight) {
        return Math.min((double) maxWidth / width, (double) maxHeight / height);
    }
}
