package com.ttennebkram.rgbviewer.image;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * The set of bundled images the viewer cycles through.
 * Immutable snapshot of a folder, taken by {@link #scan(Path)}.
 */
public final class ImageCatalog {

    /** Lower-case file extensions the viewer offers to open. */
    public static final List<String> SUPPORTED_EXTENSIONS = List.of(".png", ".jpg", ".jpeg", ".bmp", ".gif");

    private final Path directory;
    private final List<Path> images;

    private ImageCatalog(Path directory, List<Path> images) {
        this.directory = directory;
        this.images = Collections.unmodifiableList(images);
    }

    /**
     * Catalog with no images, used before the folder has been scanned.
     */
    public static ImageCatalog empty(Path directory) {
        return new ImageCatalog(directory, new ArrayList<>());
    }

    /**
     * List the supported images in a folder, sorted by file name.
     * The folder is created if it does not exist yet.
     *
     * @throws IOException if the folder cannot be created or read
     */
    public static ImageCatalog scan(Path directory) throws IOException {
        if (!Files.exists(directory)) {
            Files.createDirectories(directory);
            System.out.println("Created images folder: " + directory.toAbsolutePath());
        }
        return list(directory);
    }

    /**
     * List the supported images in an existing folder without touching the file system.
     *
     * @throws NoSuchFileException if the folder does not exist
     * @throws IOException if the folder cannot be read
     */
    public static ImageCatalog list(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new NoSuchFileException(directory.toString(), null, "Images folder not found");
        }

        List<Path> found = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (Path entry : stream) {
                if (Files.isRegularFile(entry) && isSupported(entry)) {
                    found.add(entry);
                }
            }
        }
        found.sort((a, b) -> a.getFileName().toString().compareToIgnoreCase(b.getFileName().toString()));

        if (found.isEmpty()) {
            System.out.println("No images found in folder '" + directory
                + "'. Add images there to cycle through them.");
        }
        return new ImageCatalog(directory, found);
    }

    public static boolean isSupported(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        for (String ext : SUPPORTED_EXTENSIONS) {
            if (name.endsWith(ext)) {
                return true;
            }
        }
        return false;
    }

    public Path getDirectory() {
        return directory;
    }

    public List<Path> getImages() {
        return images;
    }

    public int size() {
        return images.size();
    }

    public boolean isEmpty() {
        return images.isEmpty();
    }

    public Path get(int index) {
        return images.get(index);
    }

    /**
     * Index after the given one, wrapping around to the first image.
     *
     * @throws IllegalStateException if the catalog is empty
     */
    public int nextIndex(int current) {
        if (images.isEmpty()) {
            throw new IllegalStateException("No images in " + directory);
        }
        return Math.floorMod(current + 1, images.size());
    }
}
