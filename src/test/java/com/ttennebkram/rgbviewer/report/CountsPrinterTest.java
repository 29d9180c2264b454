package com.ttennebkram.rgbviewer.report;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.ttennebkram.rgbviewer.image.OpenCvImageLoader;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.imgcodecs.Imgcodecs;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class CountsPrinterTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final CountsPrinter printer = new CountsPrinter(
        new OpenCvImageLoader(), new PrintStream(buffer, true, StandardCharsets.UTF_8));

    @BeforeAll
    static void loadOpenCV() {
        nu.pattern.OpenCV.loadLocally();
    }

    private void writeSolid(String name, Scalar bgr) {
        Mat mat = new Mat(2, 2, CvType.CV_8UC3, bgr);
        assertTrue(Imgcodecs.imwrite(tempDir.resolve(name).toString(), mat));
        mat.release();
    }

    private String[] lines() {
        String out = buffer.toString(StandardCharsets.UTF_8).trim();
        return out.isEmpty() ? new String[0] : out.split("\\R");
    }

    @Test
    void printsOneReportPerCatalogImage() throws IOException {
        writeSolid("a.png", new Scalar(0, 0, 255));
        writeSolid("b.png", new Scalar(255, 255, 255));

        int failures = printer.print(tempDir, null);

        assertEquals(0, failures);
        String[] lines = lines();
        assertEquals(2, lines.length);
        JsonObject first = JsonParser.parseString(lines[0]).getAsJsonObject();
        assertEquals("a.png", first.get("image").getAsString());
        assertEquals(4, first.getAsJsonObject("red").get("count").getAsLong());
        assertEquals(0, first.getAsJsonObject("green").get("count").getAsLong());
        JsonObject second = JsonParser.parseString(lines[1]).getAsJsonObject();
        assertEquals(100.0, second.getAsJsonObject("blue").get("percentage").getAsDouble(), 1e-9);
    }

    @Test
    void singleFileOverridesCatalog() throws IOException {
        writeSolid("a.png", new Scalar(0, 0, 0));
        writeSolid("b.png", new Scalar(0, 0, 0));

        int failures = printer.print(tempDir, tempDir.resolve("b.png"));

        assertEquals(0, failures);
        assertEquals(1, lines().length);
    }

    @Test
    void unreadableImagesCountedAsFailures() throws IOException {
        writeSolid("good.png", new Scalar(0, 0, 0));
        Files.write(tempDir.resolve("junk.jpg"), new byte[]{1, 2, 3});

        int failures = printer.print(tempDir, null);

        assertEquals(1, failures);
        assertEquals(1, lines().length);
    }

    @Test
    void missingImagesFolder_reportedNotCreated() {
        Path images = tempDir.resolve("no-such-folder");
        assertThrows(IOException.class, () -> printer.print(images, null));
        assertFalse(Files.exists(images));
        assertEquals(0, lines().length);
    }
}
