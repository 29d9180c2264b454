package com.ttennebkram.rgbviewer.report;

import com.ttennebkram.rgbviewer.image.ImageCatalog;
import com.ttennebkram.rgbviewer.image.ImageLoader;
import com.ttennebkram.rgbviewer.session.AnalyzedImage;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Headless mode: analyze images and print one JSON report per line.
 */
public class CountsPrinter {

    private final ImageLoader loader;
    private final PrintStream out;

    public CountsPrinter(ImageLoader loader, PrintStream out) {
        this.loader = loader;
        this.out = out;
    }

    /**
     * Print reports for the given file, or for every catalog image when file is null.
     * Images that fail to load are reported on stderr and skipped.
     * The images folder is only read, never created.
     *
     * @return number of images that failed
     * @throws IOException if the images folder is missing or unreadable
     */
    public int print(Path imagesDir, Path file) throws IOException {
        List<Path> paths = new ArrayList<>();
        if (file != null) {
            paths.add(file);
        } else {
            paths.addAll(ImageCatalog.list(imagesDir).getImages());
        }

        int failures = 0;
        for (Path path : paths) {
            try {
                AnalyzedImage analyzed = AnalyzedImage.analyze(loader.load(path));
                try {
                    out.println(AnalysisReportSerializer.toJsonLine(analyzed.image, analyzed.counts));
                } finally {
                    analyzed.release();
                }
            } catch (IOException e) {
                System.err.println("Failed to load image " + path + ": " + e.getMessage());
                failures++;
            }
        }
        return failures;
    }
}
