package com.ttennebkram.rgbviewer.analysis;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Conversion of decoded OpenCV images, which arrive in BGR(A) order.
 */
class PixelBufferMatTest {

    @BeforeAll
    static void loadOpenCV() {
        nu.pattern.OpenCV.loadLocally();
    }

    @Test
    void bgrMat_mappedToRgb() {
        // Scalar is (B, G, R): a pure red image
        Mat red = new Mat(3, 4, CvType.CV_8UC3, new Scalar(0, 0, 255));
        try {
            PixelBuffer buffer = PixelBuffer.fromMat(red);
            assertEquals(255, buffer.sample(0, 0, 0));
            assertEquals(0, buffer.sample(0, 0, 2));

            ChannelCounts counts = ChannelBrightnessAnalyzer.analyze(red);
            assertEquals(new ChannelCounts(12, 0, 0, 12), counts);
        } finally {
            red.release();
        }
    }

    @Test
    void bgraMat_alphaIgnored() {
        Mat blue = new Mat(2, 2, CvType.CV_8UC4, new Scalar(200, 0, 0, 0));
        try {
            assertEquals(new ChannelCounts(0, 0, 4, 4), ChannelBrightnessAnalyzer.analyze(blue));
        } finally {
            blue.release();
        }
    }

    @Test
    void grayMat_countedForAllChannels() {
        Mat gray = new Mat(5, 5, CvType.CV_8UC1, new Scalar(129));
        try {
            assertEquals(new ChannelCounts(25, 25, 25, 25), ChannelBrightnessAnalyzer.analyze(gray));
        } finally {
            gray.release();
        }
    }

    @Test
    void sixteenBitMat_scaledToEightBit() {
        // 0x8000 / 257 = 127.5 -> not bright; 0xFFFF -> 255 bright
        Mat deep = new Mat(1, 2, CvType.CV_16UC1);
        try {
            deep.put(0, 0, new short[]{(short) 0xFFFF, (short) 0x8000});
            PixelBuffer buffer = PixelBuffer.fromMat(deep);
            assertEquals(255, buffer.sample(0, 0, 0));
            assertTrue(buffer.sample(0, 1, 0) <= 128);
            assertEquals(new ChannelCounts(1, 1, 1, 2), ChannelBrightnessAnalyzer.analyze(buffer));
        } finally {
            deep.release();
        }
    }

    @Test
    void emptyMat_treatedAsAbsent() {
        Mat empty = new Mat();
        assertNull(PixelBuffer.fromMat(empty));
        assertEquals(ChannelCounts.EMPTY, ChannelBrightnessAnalyzer.analyze(empty));
        assertEquals(ChannelCounts.EMPTY, ChannelBrightnessAnalyzer.analyze((Mat) null));
    }

    @Test
    void floatMat_rejected() {
        Mat floats = new Mat(2, 2, CvType.CV_32FC3, new Scalar(0.5, 0.5, 0.5));
        try {
            assertThrows(InvalidInputException.class, () -> PixelBuffer.fromMat(floats));
        } finally {
            floats.release();
        }
    }

    @Test
    void twoChannelMat_rejected() {
        Mat twoChannel = new Mat(2, 2, CvType.CV_8UC2, new Scalar(0, 0));
        try {
            assertThrows(InvalidInputException.class, () -> ChannelBrightnessAnalyzer.analyze(twoChannel));
        } finally {
            twoChannel.release();
        }
    }
}
