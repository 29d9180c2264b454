package com.ttennebkram.rgbviewer;

import com.ttennebkram.rgbviewer.image.OpenCvImageLoader;
import com.ttennebkram.rgbviewer.report.CountsPrinter;

import java.io.IOException;
import java.util.Arrays;
import java.util.logging.Filter;
import java.util.logging.Logger;

/**
 * Launcher class for the JavaFX application.
 * This is needed because JavaFX Application classes cannot be launched
 * directly from a shaded/uber JAR - we need a non-Application main class.
 */
public class RgbViewerLauncher {

    private static final String APP_NAME = "RGB Brightness Viewer";

    public static void main(String[] args) {
        ViewerOptions options;
        try {
            options = ViewerOptions.parse(Arrays.asList(args));
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            ViewerOptions.printHelp();
            System.exit(2);
            return;
        }
        if (options.showHelp) {
            ViewerOptions.printHelp();
            return;
        }

        // Load OpenCV native library
        nu.pattern.OpenCV.loadLocally();

        if (options.printCounts) {
            int failures;
            try {
                failures = new CountsPrinter(new OpenCvImageLoader(), System.out)
                    .print(options.imagesDir, options.startFile);
            } catch (IOException e) {
                System.err.println("Cannot read images folder " + options.imagesDir + ": " + e.getMessage());
                failures = 1;
            }
            System.exit(failures == 0 ? 0 : 1);
            return;
        }

        suppressJavaFXModuleWarning();

        // Set macOS application name (must be done before any AWT/JavaFX initialization)
        System.setProperty("apple.awt.application.name", APP_NAME);
        System.setProperty("com.apple.mrj.application.apple.menu.about.name", APP_NAME);

        RgbViewerApp.main(args);
    }

    /**
     * Suppress the harmless "Unsupported JavaFX configuration" warning that occurs
     * when JavaFX is loaded from the classpath rather than as a proper module.
     */
    private static void suppressJavaFXModuleWarning() {
        Logger javafxLogger = Logger.getLogger("javafx");
        Filter existingFilter = javafxLogger.getFilter();
        javafxLogger.setFilter(record -> {
            String msg = record.getMessage();
            if (msg != null && msg.contains("Unsupported JavaFX configuration")) {
                return false;
            }
            return existingFilter == null || existingFilter.isLoggable(record);
        });
    }
}
