package com.ttennebkram.rgbviewer.fx;

import javafx.scene.image.ImageView;
import javafx.scene.layout.StackPane;
import org.opencv.core.Mat;

/**
 * Shows one image centered and scaled to fit, rescaling whenever the pane is resized.
 * The Mat is borrowed, not owned; callers release it after calling {@link #setImage(Mat)} with its replacement.
 */
public class ImagePane extends StackPane {

    /** Margin kept free around the image, in pixels. */
    private static final int PADDING = 10;

    private final ImageView imageView = new ImageView();
    private Mat source;
    private int renderedWidth = -1;
    private int renderedHeight = -1;

    public ImagePane() {
        setStyle("-fx-background-color: white; -fx-border-color: #cccccc;");
        setMinSize(100, 100);
        imageView.setPreserveRatio(true);
        getChildren().add(imageView);

        widthProperty().addListener((obs, oldVal, newVal) -> refresh(false));
        heightProperty().addListener((obs, oldVal, newVal) -> refresh(false));
    }

    public void setImage(Mat mat) {
        this.source = mat;
        refresh(true);
    }

    /**
     * Re-render the image for the current pane size.
     *
     * @param force render even if the size has not changed
     */
    public void refresh(boolean force) {
        int w = (int) getWidth() - PADDING;
        int h = (int) getHeight() - PADDING;
        if (source == null || source.empty()) {
            imageView.setImage(null);
            return;
        }
        if (w <= 0 || h <= 0) {
            return;  // not laid out yet
        }
        if (!force && w == renderedWidth && h == renderedHeight) {
            return;
        }
        imageView.setImage(FXImageUtils.matToImage(source, w, h));
        renderedWidth = w;
        renderedHeight = h;
    }
}
