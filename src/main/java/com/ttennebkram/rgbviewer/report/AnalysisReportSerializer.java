package com.ttennebkram.rgbviewer.report;

import com.google.gson.*;
import com.ttennebkram.rgbviewer.analysis.Channel;
import com.ttennebkram.rgbviewer.analysis.ChannelBrightnessAnalyzer;
import com.ttennebkram.rgbviewer.analysis.ChannelCounts;
import com.ttennebkram.rgbviewer.image.LoadedImage;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Writes and reads brightness analysis reports as JSON.
 */
public class AnalysisReportSerializer {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();
    private static final Gson GSON_COMPACT = new Gson();

    /**
     * Build the report for one image.
     */
    public static JsonObject toJson(LoadedImage image, ChannelCounts counts) {
        JsonObject root = new JsonObject();

        if (image != null) {
            root.addProperty("image", image.getName());
            root.addProperty("path", image.path.toAbsolutePath().toString());
            root.addProperty("format", image.format);
            root.addProperty("width", image.getWidth());
            root.addProperty("height", image.getHeight());
            root.addProperty("channels", image.getChannels());
        }
        root.addProperty("threshold", ChannelBrightnessAnalyzer.THRESHOLD);
        root.addProperty("totalPixels", counts.getTotalPixels());

        for (Channel channel : Channel.values()) {
            JsonObject channelJson = new JsonObject();
            channelJson.addProperty("count", counts.get(channel));
            channelJson.addProperty("percentage", counts.percentage(channel));
            root.add(key(channel), channelJson);
        }
        return root;
    }

    /**
     * One-line form used by the headless --print_counts mode.
     */
    public static String toJsonLine(LoadedImage image, ChannelCounts counts) {
        return GSON_COMPACT.toJson(toJson(image, counts));
    }

    /**
     * Save a report to a pretty-printed JSON file.
     */
    public static void save(Path path, LoadedImage image, ChannelCounts counts) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            GSON.toJson(toJson(image, counts), writer);
        }
    }

    /**
     * Read the counts back from a saved report.
     */
    public static ChannelCounts readCounts(Path path) throws IOException {
        JsonObject root;
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            JsonElement parsed = JsonParser.parseReader(reader);
            if (parsed == null || !parsed.isJsonObject()) {
                throw new IOException("Invalid report file: not a valid JSON object");
            }
            root = parsed.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new IOException("Invalid report file: " + e.getMessage());
        }

        if (!root.has("totalPixels")) {
            throw new IOException("Invalid report file: missing 'totalPixels'");
        }
        try {
            long[] values = new long[Channel.values().length];
            for (Channel channel : Channel.values()) {
                JsonElement channelJson = root.get(key(channel));
                if (channelJson == null || !channelJson.isJsonObject()
                        || !channelJson.getAsJsonObject().has("count")) {
                    throw new IOException("Invalid report file: missing count for '" + key(channel) + "'");
                }
                values[channel.ordinal()] = channelJson.getAsJsonObject().get("count").getAsLong();
            }
            return new ChannelCounts(values[0], values[1], values[2], root.get("totalPixels").getAsLong());
        } catch (IllegalArgumentException | IllegalStateException | UnsupportedOperationException e) {
            // Non-numeric values or counts outside [0, totalPixels]
            throw new IOException("Invalid report file: " + e.getMessage());
        }
    }

    private static String key(Channel channel) {
        return channel.name().toLowerCase(Locale.ROOT);
    }
}
