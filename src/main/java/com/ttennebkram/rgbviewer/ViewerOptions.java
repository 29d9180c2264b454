package com.ttennebkram.rgbviewer;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;

/**
 * Command line options for the viewer.
 */
public class ViewerOptions {

    public static final String DEFAULT_IMAGES_DIR = "images";
    public static final int DEFAULT_WIDTH = 1000;
    public static final int DEFAULT_HEIGHT = 700;
    public static final int MIN_WIDTH = 800;
    public static final int MIN_HEIGHT = 600;

    public boolean showHelp = false;
    public boolean printCounts = false;
    public Path imagesDir = Paths.get(DEFAULT_IMAGES_DIR);
    public Path startFile = null;
    public int windowWidth = DEFAULT_WIDTH;
    public int windowHeight = DEFAULT_HEIGHT;

    /**
     * Parse raw arguments.
     *
     * @throws IllegalArgumentException for unknown options or bad values
     */
    public static ViewerOptions parse(List<String> params) {
        ViewerOptions options = new ViewerOptions();
        for (int i = 0; i < params.size(); i++) {
            String param = params.get(i);
            if ("-h".equals(param) || "--help".equals(param)) {
                options.showHelp = true;
            } else if ("--print_counts".equals(param)) {
                options.printCounts = true;
            } else if ("--images_dir".equals(param)) {
                if (i + 1 >= params.size()) {
                    throw new IllegalArgumentException("--images_dir requires a folder argument");
                }
                options.imagesDir = Paths.get(params.get(++i));
            } else if ("--window_size".equals(param)) {
                if (i + 1 >= params.size()) {
                    throw new IllegalArgumentException("--window_size requires a value (e.g., 1000x700)");
                }
                options.parseWindowSize(params.get(++i));
            } else if (!param.startsWith("-")) {
                // Non-flag argument is the image to open first
                if (options.startFile != null) {
                    throw new IllegalArgumentException("Only one image file may be given, got: "
                        + options.startFile + " and " + param);
                }
                options.startFile = Paths.get(param);
            } else {
                throw new IllegalArgumentException("Unknown option: " + param);
            }
        }
        return options;
    }

    private void parseWindowSize(String value) {
        String[] parts = value.toLowerCase(Locale.ROOT).split("x");
        if (parts.length != 2) {
            throw new IllegalArgumentException("--window_size must look like WIDTHxHEIGHT, got: " + value);
        }
        try {
            windowWidth = Integer.parseInt(parts[0].trim());
            windowHeight = Integer.parseInt(parts[1].trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--window_size must look like WIDTHxHEIGHT, got: " + value);
        }
        if (windowWidth < MIN_WIDTH || windowHeight < MIN_HEIGHT) {
            throw new IllegalArgumentException("--window_size must be at least "
                + MIN_WIDTH + "x" + MIN_HEIGHT + ", got: " + value);
        }
    }

    public static void printHelp() {
        System.out.println("RGB Brightness Viewer");
        System.out.println();
        System.out.println("Usage: java -jar rgb-brightness-viewer.jar [options] [image]");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  -h, --help                     Show this help message and exit");
        System.out.println("  --images_dir DIR               Folder of images to cycle through (default: images)");
        System.out.println("  --window_size WxH              Initial window size (default: 1000x700, minimum 800x600)");
        System.out.println("  --print_counts                 Print a JSON report per image and exit, without a window");
        System.out.println();
        System.out.println("Examples:");
        System.out.println("  java -jar rgb-brightness-viewer.jar");
        System.out.println("  java -jar rgb-brightness-viewer.jar photo.png");
        System.out.println("  java -jar rgb-brightness-viewer.jar --images_dir ~/Pictures --print_counts");
    }
}
