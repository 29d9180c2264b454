package com.ttennebkram.rgbviewer.report;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.ttennebkram.rgbviewer.analysis.ChannelCounts;
import com.ttennebkram.rgbviewer.image.LoadedImage;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisReportSerializerTest {

    @TempDir
    Path tempDir;

    @BeforeAll
    static void loadOpenCV() {
        nu.pattern.OpenCV.loadLocally();
    }

    @Test
    void reportDescribesImageAndChannels() {
        Mat mat = new Mat(2, 2, CvType.CV_8UC3);
        LoadedImage image = new LoadedImage(tempDir.resolve("scene.png"), "PNG", mat);
        try {
            JsonObject json = AnalysisReportSerializer.toJson(image, new ChannelCounts(1, 1, 1, 4));
            assertEquals("scene.png", json.get("image").getAsString());
            assertEquals("PNG", json.get("format").getAsString());
            assertEquals(2, json.get("width").getAsInt());
            assertEquals(2, json.get("height").getAsInt());
            assertEquals(3, json.get("channels").getAsInt());
            assertEquals(128, json.get("threshold").getAsInt());
            assertEquals(4, json.get("totalPixels").getAsLong());
            assertEquals(1, json.getAsJsonObject("red").get("count").getAsLong());
            assertEquals(25.0, json.getAsJsonObject("blue").get("percentage").getAsDouble(), 1e-9);
        } finally {
            image.release();
        }
    }

    @Test
    void reportWithoutImage_hasOnlyCounts() {
        JsonObject json = AnalysisReportSerializer.toJson(null, ChannelCounts.EMPTY);
        assertFalse(json.has("image"));
        assertEquals(0, json.get("totalPixels").getAsLong());
        assertEquals(0.0, json.getAsJsonObject("green").get("percentage").getAsDouble());
    }

    @Test
    void jsonLineIsSingleLine() {
        String line = AnalysisReportSerializer.toJsonLine(null, new ChannelCounts(1, 2, 3, 4));
        assertFalse(line.contains("\n"));
        assertEquals(3, JsonParser.parseString(line).getAsJsonObject()
            .getAsJsonObject("blue").get("count").getAsInt());
    }

    @Test
    void savedReportReadsBack() throws IOException {
        Path file = tempDir.resolve("report.json");
        ChannelCounts counts = new ChannelCounts(7, 0, 12, 20);
        AnalysisReportSerializer.save(file, null, counts);
        assertEquals(counts, AnalysisReportSerializer.readCounts(file));
    }

    @Test
    void notJson_rejected() throws IOException {
        Path file = tempDir.resolve("bad.json");
        Files.write(file, "{ not json".getBytes(StandardCharsets.UTF_8));
        assertThrows(IOException.class, () -> AnalysisReportSerializer.readCounts(file));
    }

    @Test
    void missingChannel_rejected() throws IOException {
        Path file = tempDir.resolve("partial.json");
        Files.write(file, "{\"totalPixels\": 4, \"red\": {\"count\": 1}, \"green\": {\"count\": 1}}"
            .getBytes(StandardCharsets.UTF_8));
        IOException e = assertThrows(IOException.class, () -> AnalysisReportSerializer.readCounts(file));
        assertTrue(e.getMessage().contains("blue"), e.getMessage());
    }

    @Test
    void countAboveTotal_rejected() throws IOException {
        Path file = tempDir.resolve("inconsistent.json");
        Files.write(file, ("{\"totalPixels\": 4, \"red\": {\"count\": 9}, "
            + "\"green\": {\"count\": 1}, \"blue\": {\"count\": 1}}").getBytes(StandardCharsets.UTF_8));
        assertThrows(IOException.class, () -> AnalysisReportSerializer.readCounts(file));
    }
}
