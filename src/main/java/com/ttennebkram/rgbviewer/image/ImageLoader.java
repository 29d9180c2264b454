package com.ttennebkram.rgbviewer.image;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Decodes an image file. No UI dependencies.
 */
@FunctionalInterface
public interface ImageLoader {
    /**
     * Load and decode an image.
     *
     * @param path The file to read
     * @return The decoded image (caller must release when done)
     * @throws IOException if the file is missing, unreadable or not a decodable image
     */
    LoadedImage load(Path path) throws IOException;
}
